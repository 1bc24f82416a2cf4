package com.eyelevel.dispatcher.repository;

import com.eyelevel.dispatcher.model.FileDispatchState;
import com.eyelevel.dispatcher.model.SubmissionFile;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface SubmissionFileRepository extends ExpirableRepository<SubmissionFile, Long> {

    Optional<SubmissionFile> findBySubmissionIdAndSha256(String submissionId, String sha256);

    boolean existsBySubmissionIdAndSha256(String submissionId, String sha256);

    long countBySubmissionId(String submissionId);

    long countBySubmissionIdAndStateNot(String submissionId, FileDispatchState state);

    List<SubmissionFile> findAllBySubmissionId(String submissionId);

    @Modifying
    @Query("UPDATE SubmissionFile f SET f.expiryTs = :expiryTs WHERE f.submissionId = :sid")
    int updateExpiryForSubmission(@Param("sid") String sid, @Param("expiryTs") LocalDateTime expiryTs);
}
