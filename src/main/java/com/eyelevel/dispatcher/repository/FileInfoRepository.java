package com.eyelevel.dispatcher.repository;

import com.eyelevel.dispatcher.model.FileInfo;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface FileInfoRepository extends ExpirableRepository<FileInfo, String> {

    List<FileInfo> findAllBySha256In(Collection<String> sha256s);
}
