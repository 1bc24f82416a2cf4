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
 * Content-addressed file record. The blob lives in the file store under the sha256.
 */
@Entity
@Table(name = "file_info")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileInfo implements ExpirableRecord {

    @Id
    @Column(nullable = false)
    private String sha256;

    private String fileType;

    private boolean archived;

    private LocalDateTime expiryTs;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Override
    public String getStorageKey() {
        return sha256;
    }
}
