package com.example.parkmaster.Repositories;

import com.example.parkmaster.Models.ParkingLot;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ParkingLotRepository extends JpaRepository<ParkingLot, String> {

    Page<ParkingLot> findByNameContainingIgnoreCase(String name, Pageable pageable);

    List<ParkingLot> findAllByOrderByNameAsc();
}
