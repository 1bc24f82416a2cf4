package com.eyelevel.dispatcher.repository;

import com.eyelevel.dispatcher.model.ExpirableRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

import java.time.LocalDateTime;

/**
 * Queries shared by every collection the expiry sweep visits. Records with a {@code null} expiry never match.
 */
@NoRepositoryBean
public interface ExpirableRepository<T extends ExpirableRecord, ID> extends JpaRepository<T, ID> {

    long countByExpiryTsBefore(LocalDateTime cutoff);

    Slice<T> findByExpiryTsBefore(LocalDateTime cutoff, Pageable pageable);
}
