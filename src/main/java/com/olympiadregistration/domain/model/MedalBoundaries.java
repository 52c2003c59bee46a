package com.olympiadregistration.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Minimum totals for gold, silver and bronze. Either all three are set or
 * none is.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MedalBoundaries {

    @Column(name = "gold_boundary")
    private Integer gold;

    @Column(name = "silver_boundary")
    private Integer silver;

    @Column(name = "bronze_boundary")
    private Integer bronze;

    public static MedalBoundaries unset() {
        return new MedalBoundaries(null, null, null);
    }

    /**
     * @throws IllegalArgumentException if only some of the three are given
     */
    public static MedalBoundaries of(Integer gold, Integer silver, Integer bronze) {
        boolean any = gold != null || silver != null || bronze != null;
        boolean all = gold != null && silver != null && bronze != null;
        if (any && !all) {
            throw new IllegalArgumentException("Medal boundaries must be set or unset together");
        }
        return new MedalBoundaries(gold, silver, bronze);
    }

    public boolean isSet() {
        return gold != null;
    }

    @Override
    public String toString() {
        return isSet()
            ? "Gold " + gold + ", Silver " + silver + ", Bronze " + bronze
            : "unset";
    }
}
