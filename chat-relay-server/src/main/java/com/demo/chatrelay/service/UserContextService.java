package com.demo.chatrelay.service;

import com.demo.chatrelay.domain.ProjectEntity;
import com.demo.chatrelay.domain.QueryIntent;
import com.demo.chatrelay.domain.TaskEntity;
import com.demo.chatrelay.domain.UserEntity;
import com.demo.chatrelay.repository.ProjectRepository;
import com.demo.chatrelay.repository.TaskRepository;
import com.demo.chatrelay.repository.UserRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Decides whether an assistant prompt is about the user's own data and, if so,
 * renders a plain-text summary of it for the system prompt.
 */
@Service
public class UserContextService {

    static final List<String> PROJECT_KEYWORDS =
            List.of("project", "projects", "status", "deadline", "progress", "budget");
    static final List<String> TASK_KEYWORDS =
            List.of("task", "tasks", "todo", "to-do", "assigned", "pending", "completed");
    static final List<String> PROFILE_KEYWORDS =
            List.of("my profile", "my info", "my account", "my details", "who am i");

    private static final int MAX_PROJECTS = 5;

    private final UserRepository userRepository;
    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;

    public UserContextService(UserRepository userRepository,
                              ProjectRepository projectRepository,
                              TaskRepository taskRepository) {
        this.userRepository = userRepository;
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
    }

    public QueryIntent analyzeQueryIntent(String query) {
        String lower = query.toLowerCase(Locale.ROOT);

        boolean project = containsAny(lower, PROJECT_KEYWORDS);
        boolean task = containsAny(lower, TASK_KEYWORDS);
        boolean profile = containsAny(lower, PROFILE_KEYWORDS);

        boolean dataQuery = project || task || profile
                || lower.contains("my ") || lower.contains("what is my");

        QueryIntent.QueryType type = QueryIntent.QueryType.GENERAL;
        if (project) {
            type = QueryIntent.QueryType.PROJECT;
        } else if (task) {
            type = QueryIntent.QueryType.TASK;
        } else if (profile) {
            type = QueryIntent.QueryType.PROFILE;
        }

        List<String> matched = Stream.of(PROJECT_KEYWORDS, TASK_KEYWORDS, PROFILE_KEYWORDS)
                .flatMap(List::stream)
                .filter(lower::contains)
                .collect(Collectors.toList());

        return QueryIntent.builder()
                .dataQuery(dataQuery)
                .queryType(type)
                .keywords(matched)
                .build();
    }

    /**
     * Profile plus the most recently updated projects and their tasks, or an
     * empty string for an unknown user.
     */
    @Transactional(readOnly = true)
    public String getUserContext(String userId) {
        Optional<UserEntity> found = userRepository.findById(userId);
        if (found.isEmpty()) {
            return "";
        }
        UserEntity user = found.get();

        List<String> lines = new ArrayList<>();
        lines.add("\n=== USER PROFILE ===");
        lines.add("Name: " + user.getUsername());
        appendIfPresent(lines, "Email: ", user.getEmail());
        appendIfPresent(lines, "Role: ", user.getRole());
        appendIfPresent(lines, "Company: ", user.getCompany());
        appendIfPresent(lines, "Bio: ", user.getBio());

        List<ProjectEntity> projects = projectRepository.findByUserIdOrderByUpdatedAtDesc(
                userId, PageRequest.of(0, MAX_PROJECTS));

        if (projects.isEmpty()) {
            lines.add("\n=== No projects yet ===");
            return String.join("\n", lines);
        }

        Map<String, List<TaskEntity>> tasksByProject = taskRepository
                .findByProjectIdInOrderByCreatedAtAsc(projects.stream().map(ProjectEntity::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(TaskEntity::getProjectId));

        lines.add("\n=== USER'S PROJECTS (" + projects.size() + ") ===");
        for (ProjectEntity project : projects) {
            lines.add("\nProject: " + project.getName());
            lines.add("  Status: " + project.getStatus());
            lines.add("  Priority: " + project.getPriority());
            lines.add("  Progress: " + project.getProgress() + "%");
            appendIfPresent(lines, "  Description: ", project.getDescription());
            if (project.getDeadline() != null) {
                lines.add("  Deadline: " + project.getDeadline());
            }
            if (project.getBudget() != null) {
                lines.add("  Budget: $" + project.getBudget().toPlainString());
            }

            List<TaskEntity> tasks = tasksByProject.getOrDefault(project.getId(), List.of());
            if (!tasks.isEmpty()) {
                lines.add("  Tasks (" + tasks.size() + "):");
                for (TaskEntity task : tasks) {
                    lines.add("    - " + task.getTitle() + " [" + task.getStatus() + "] ("
                            + task.getPriority() + " priority)");
                }
            }
        }

        return String.join("\n", lines);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }

    private static void appendIfPresent(List<String> lines, String label, String value) {
        if (value != null && !value.isBlank()) {
            lines.add(label + value);
        }
    }
}
