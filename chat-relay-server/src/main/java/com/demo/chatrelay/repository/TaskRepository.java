package com.demo.chatrelay.repository;

import com.demo.chatrelay.domain.TaskEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TaskRepository extends JpaRepository<TaskEntity, String> {

    List<TaskEntity> findByProjectIdInOrderByCreatedAtAsc(Collection<String> projectIds);
}
