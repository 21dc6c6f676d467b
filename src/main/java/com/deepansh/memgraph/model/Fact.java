package com.deepansh.memgraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single piece of information attached to one entity.
 *
 * Stored as one element of the entity's items.json array.
 * Timestamps stay as the ISO strings found on disk: legacy files mix plain
 * dates and date-times, and a value that does not parse must still load
 * (salience scoring treats it as a low-weight access).
 *
 * Defaulting rules for legacy records:
 * - status missing       -> active
 * - lastAccessed missing -> timestamp
 * - accessCount missing  -> 1
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Fact {

    public static final int DEFAULT_ACCESS_COUNT = 1;

    private String id;

    private String fact;

    private String category;

    /** Classification produced by the upstream extractor. */
    private String type;

    private String timestamp;

    private String source;

    @Builder.Default
    private FactStatus status = FactStatus.ACTIVE;

    private String supersededBy;

    private String lastAccessed;

    private Integer accessCount;

    @JsonIgnore
    public boolean isActive() {
        return status == null || status == FactStatus.ACTIVE;
    }

    @JsonIgnore
    public String effectiveLastAccessed() {
        return lastAccessed != null ? lastAccessed : timestamp;
    }

    @JsonIgnore
    public int effectiveAccessCount() {
        return accessCount != null ? accessCount : DEFAULT_ACCESS_COUNT;
    }

    @JsonIgnore
    public boolean hasSalienceData() {
        return lastAccessed != null && accessCount != null;
    }
}
