package com.eyelevel.dispatcher.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * An artifact cached by a service in the cache store.
 */
@Entity
@Table(name = "cached_file")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedFile implements ExpirableRecord {

    @Id
    @Column(nullable = false)
    private String cacheKey;

    private String component;

    private LocalDateTime expiryTs;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Override
    public String getStorageKey() {
        return cacheKey;
    }
}
