package com.eyelevel.dispatcher.repository;

import com.eyelevel.dispatcher.model.Submission;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SubmissionRepository extends ExpirableRepository<Submission, String> {

    /**
     * Loads a submission with a write lock so that signals for the same submission handled on
     * different threads are applied one after another.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Submission s WHERE s.sid = :sid")
    Optional<Submission> findByIdForUpdate(@Param("sid") String sid);
}
