package com.eyelevel.dispatcher.repository;

import com.eyelevel.dispatcher.model.ServiceDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ServiceDefinitionRepository extends JpaRepository<ServiceDefinition, String> {
}
