package com.eyelevel.dispatcher.repository;

import com.eyelevel.dispatcher.model.CachedFile;
import org.springframework.stereotype.Repository;

@Repository
public interface CachedFileRepository extends ExpirableRepository<CachedFile, String> {
}
