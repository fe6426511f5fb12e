package com.demo.chatrelay.repository;

import com.demo.chatrelay.domain.ProjectEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectRepository extends JpaRepository<ProjectEntity, String> {

    List<ProjectEntity> findByUserIdOrderByUpdatedAtDesc(String userId, Pageable pageable);

    boolean existsByUserId(String userId);
}
