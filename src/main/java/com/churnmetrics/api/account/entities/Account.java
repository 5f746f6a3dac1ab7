package com.churnmetrics.api.account.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code account} table in the database.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    @Id
    private long id;

    @Version
    private long version;

    /**
     * IANA timezone id, e.g. {@code America/Los_Angeles}. Calendar days of all analytics reports
     * are anchored to this timezone.
     */
    @NonNull
    @Column(name = "timezone")
    @Builder.Default
    private String timeZone = "UTC";

    /**
     * Non-null when the account has been promoted to a large account.
     */
    private OffsetDateTime largeSince;

    public boolean isLarge() {
        return largeSince != null;
    }
}
