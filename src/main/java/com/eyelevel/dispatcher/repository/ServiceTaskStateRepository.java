package com.eyelevel.dispatcher.repository;

import com.eyelevel.dispatcher.model.ServiceTaskState;
import com.eyelevel.dispatcher.model.TaskStatus;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ServiceTaskStateRepository extends ExpirableRepository<ServiceTaskState, Long> {

    Optional<ServiceTaskState> findBySubmissionIdAndSha256AndServiceName(String submissionId, String sha256,
                                                                         String serviceName);

    /**
     * Counts the outstanding tasks of one stage of one file when called with {@link TaskStatus#QUEUED}.
     */
    long countBySubmissionIdAndSha256AndStageIndexAndStatus(String submissionId, String sha256, int stageIndex,
                                                            TaskStatus status);

    long countBySubmissionIdAndStatus(String submissionId, TaskStatus status);

    List<ServiceTaskState> findAllBySubmissionId(String submissionId);

    List<ServiceTaskState> findAllBySubmissionIdAndStatus(String submissionId, TaskStatus status);

    @Modifying
    @Query("UPDATE ServiceTaskState t SET t.expiryTs = :expiryTs WHERE t.submissionId = :sid")
    int updateExpiryForSubmission(@Param("sid") String sid, @Param("expiryTs") LocalDateTime expiryTs);
}
