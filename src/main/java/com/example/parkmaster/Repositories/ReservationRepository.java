package com.example.parkmaster.Repositories;

import com.example.parkmaster.Enum.Reservation.ReservationStatus;
import com.example.parkmaster.Models.Reservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface ReservationRepository extends JpaRepository<Reservation, String> {

    List<Reservation> findByParkingLotIdOrderByStartTimeAsc(String parkingLotId);

    List<Reservation> findByParkingLotIdAndStatusOrderByStartTimeAsc(String parkingLotId, ReservationStatus status);

    List<Reservation> findByParkingLotIdInAndStatus(Collection<String> parkingLotIds, ReservationStatus status);

    List<Reservation> findBySeriesIdOrderByStartTimeAsc(String seriesId);

    // Candidates for a double booking: active reservations of the space that touch [from, to]
    @Query("SELECT r FROM Reservation r " +
            "WHERE r.parkingLot.id = :parkingLotId " +
            "AND r.spaceId = :spaceId " +
            "AND r.status = :status " +
            "AND r.startTime <= :to " +
            "AND r.endTime >= :from " +
            "ORDER BY r.startTime ASC")
    List<Reservation> findOverlapping(@Param("parkingLotId") String parkingLotId,
                                      @Param("spaceId") Integer spaceId,
                                      @Param("status") ReservationStatus status,
                                      @Param("from") OffsetDateTime from,
                                      @Param("to") OffsetDateTime to);

    List<Reservation> findByStatusAndEndTimeBefore(ReservationStatus status, OffsetDateTime endTime);

    @Modifying
    @Query("DELETE FROM Reservation r WHERE r.parkingLot.id = :parkingLotId")
    int deleteByParkingLotId(@Param("parkingLotId") String parkingLotId);
}
