package com.example.parkmaster.Models;

import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "parking_lots")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParkingLot {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false, length = 36)
    private String id;

    @NotBlank
    @Size(min = 3, max = 100)
    private String name;

    @Min(1)
    @Column(name = "row_count", nullable = false)
    private Integer rows;

    @Min(1)
    @Column(name = "col_count", nullable = false)
    private Integer cols;

    @ElementCollection
    @CollectionTable(name = "parking_lot_spaces", joinColumns = @JoinColumn(name = "parking_lot_id"))
    @OrderColumn(name = "list_index")
    private List<Space> spaces = new ArrayList<>();

    // Index r marks the aisle between row r and row r + 1
    @ElementCollection
    @CollectionTable(name = "parking_lot_merged_aisles", joinColumns = @JoinColumn(name = "parking_lot_id"))
    @Column(name = "aisle_index")
    private Set<Integer> mergedAisles = new HashSet<>();

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = OffsetDateTime.now();
        updatedAt = OffsetDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
