package com.yerin.notijob.repository;

import com.yerin.notijob.domain.ExecutionDetailEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExecutionDetailRepository extends JpaRepository<ExecutionDetailEntity, Long> {
    List<ExecutionDetailEntity> findByJobIdOrderByTsAsc(String jobId);
}
