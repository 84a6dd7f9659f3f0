package com.insightreel.pipeline.repository;

import com.insightreel.pipeline.entity.PublishResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PublishResultRepository extends JpaRepository<PublishResult, Long> {
}
