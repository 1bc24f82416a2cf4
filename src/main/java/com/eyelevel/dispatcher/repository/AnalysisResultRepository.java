package com.eyelevel.dispatcher.repository;

import com.eyelevel.dispatcher.model.AnalysisResult;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AnalysisResultRepository extends ExpirableRepository<AnalysisResult, String> {

    List<AnalysisResult> findAllByResultKeyIn(Collection<String> resultKeys);
}
