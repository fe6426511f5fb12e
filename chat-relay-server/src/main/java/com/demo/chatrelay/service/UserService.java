package com.demo.chatrelay.service;

import com.demo.chatrelay.domain.ProjectEntity;
import com.demo.chatrelay.domain.TaskEntity;
import com.demo.chatrelay.domain.UserEntity;
import com.demo.chatrelay.repository.ProjectRepository;
import com.demo.chatrelay.repository.TaskRepository;
import com.demo.chatrelay.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * User bootstrap and the durable side of presence.
 */
@Slf4j
@Service
public class UserService {

    private static final String AVATAR_URL = "https://api.dicebear.com/7.x/initials/svg?seed=";

    private final UserRepository userRepository;
    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;

    public UserService(UserRepository userRepository,
                       ProjectRepository projectRepository,
                       TaskRepository taskRepository) {
        this.userRepository = userRepository;
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
    }

    public List<UserEntity> listUsers() {
        return userRepository.findHumans();
    }

    /**
     * Find a user by name or create it. New users get a sample project so the
     * assistant has something to talk about.
     */
    @Transactional
    public UserEntity login(String username, String email, String company) {
        return userRepository.findByUsername(username).orElseGet(() -> {
            UserEntity user = userRepository.save(UserEntity.builder()
                    .username(username)
                    .email(email)
                    .company(company)
                    .avatar(AVATAR_URL + URLEncoder.encode(username, StandardCharsets.UTF_8))
                    .build());
            createSampleProject(user.getId());
            log.info("Created user: userId={}, username={}", user.getId(), username);
            return user;
        });
    }

    public void setUserOnline(String userId) {
        updatePresence(userId, true);
    }

    public void setUserOffline(String userId) {
        updatePresence(userId, false);
    }

    private void updatePresence(String userId, boolean online) {
        int updated = userRepository.updatePresence(userId, online, Instant.now());
        if (updated == 0) {
            log.warn("Presence update for unknown user: userId={}, online={}", userId, online);
        }
    }

    private void createSampleProject(String userId) {
        if (projectRepository.existsByUserId(userId)) {
            return;
        }

        ProjectEntity project = projectRepository.save(ProjectEntity.builder()
                .userId(userId)
                .name("Website Redesign")
                .description("Complete redesign of company website with modern UI")
                .status("active")
                .priority("high")
                .progress(65)
                .budget(BigDecimal.valueOf(5000))
                .deadline(LocalDate.now().plusDays(30))
                .build());

        taskRepository.saveAll(List.of(
                sampleTask(project.getId(), "Design mockups", "Create UI/UX mockups in Figma", "completed", "high", null),
                sampleTask(project.getId(), "Frontend development", "Build React components", "in_progress", "high", userId),
                sampleTask(project.getId(), "Backend API", "Set up REST API endpoints", "pending", "medium", null),
                sampleTask(project.getId(), "Testing", "Write unit and integration tests", "pending", "low", null)
        ));
    }

    private TaskEntity sampleTask(String projectId, String title, String description,
                                  String status, String priority, String assigneeId) {
        return TaskEntity.builder()
                .projectId(projectId)
                .title(title)
                .description(description)
                .status(status)
                .priority(priority)
                .assigneeId(assigneeId)
                .build();
    }
}
