package com.flagship.hospital_cash.auth;

import com.flagship.hospital_cash.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Checks credentials and project permissions against the hospital database.
 */
@Service
@Slf4j
public class AuthService {

    private static final String USER_QUERY =
        "SELECT u.id, u.username, u.display_name FROM user u " +
        "WHERE u.username = ? AND u.password = MD5(?) AND u.deactivated = 0";

    private static final String PROJECT_QUERY =
        "SELECT p.id, p.name, p.abbr, p.enterprise_id FROM project p " +
        "JOIN project_permission pp ON pp.project_id = p.id " +
        "WHERE pp.user_id = ? AND p.id = ?";

    private final JdbcTemplate jdbcTemplate;

    public AuthService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Authenticates a user for a project.
     *
     * @return the user and project to store in the session
     * @throws UnauthorizedException if the credentials are wrong, the user is
     *         deactivated, or the user has no permission on the project
     */
    @Transactional(readOnly = true)
    public Authentication login(String username, String password, Integer projectId) {
        List<SessionUser> users = jdbcTemplate.query(USER_QUERY, userRowMapper(), username, password);

        if (users.isEmpty()) {
            log.warn("Failed login: username={}", username);
            throw new UnauthorizedException("Bad username and password combination.");
        }

        SessionUser user = users.get(0);

        List<SessionProject> projects = jdbcTemplate.query(PROJECT_QUERY, projectRowMapper(), user.getId(), projectId);

        if (projects.isEmpty()) {
            log.warn("Login refused, no project permission: userId={}, projectId={}", user.getId(), projectId);
            throw new UnauthorizedException("No permissions for that project.");
        }

        log.info("User logged in: userId={}, projectId={}", user.getId(), projectId);
        return new Authentication(user, projects.get(0));
    }

    private RowMapper<SessionUser> userRowMapper() {
        return (rs, rowNum) -> new SessionUser(
            rs.getInt("id"),
            rs.getString("username"),
            rs.getString("display_name")
        );
    }

    private RowMapper<SessionProject> projectRowMapper() {
        return (rs, rowNum) -> new SessionProject(
            rs.getInt("id"),
            rs.getString("name"),
            rs.getString("abbr"),
            rs.getInt("enterprise_id")
        );
    }

    /**
     * Result of a successful login.
     */
    public record Authentication(SessionUser user, SessionProject project) {}
}
