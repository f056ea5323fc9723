package com.campus.lending.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A lendable piece of equipment.
 *
 * <p>{@link #dailyLimit} is the number of Pending/Approved reservations whose windows may
 * overlap on this item at the same time. The column carries a {@code >= 1} check, but rows
 * written before that constraint or by hand are still read through
 * {@link #effectiveDailyLimit()}, which never returns less than one.
 */
@Entity
@Table(name = "equipment")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Equipment extends BaseEntity {

    public static final String DEFAULT_CONDITION = "Good";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    /** Unique via {@code uk_equipment_serial_number}. */
    @Column(name = "serial_number", nullable = false, unique = true, length = 100)
    private String serialNumber;

    @Column(name = "item_condition", nullable = false, length = 50)
    private String condition = DEFAULT_CONDITION;

    @Column(name = "location", nullable = false, length = 100)
    private String location;

    @Column(name = "daily_limit", nullable = false)
    private Integer dailyLimit = 1;

    public int effectiveDailyLimit() {
        return dailyLimit == null || dailyLimit < 1 ? 1 : dailyLimit;
    }
}
