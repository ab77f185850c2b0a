package com.schoolhub.backend.modules.teacher.application;

import com.schoolhub.backend.global.error.ProblemException;
import com.schoolhub.backend.modules.teacher.infrastructure.persistence.TeacherRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Gate for teacher-only operations: a caller is a teacher when the supplied username exists in the
 * teacher directory. There is no credential beyond that.
 */
@Component
public class TeacherAuthenticator {

    public static final String AUTHENTICATION_REQUIRED = "AUTHENTICATION_REQUIRED";

    private static final Logger log = LoggerFactory.getLogger(TeacherAuthenticator.class);

    private final TeacherRepository teacherRepository;

    public TeacherAuthenticator(TeacherRepository teacherRepository) {
        this.teacherRepository = teacherRepository;
    }

    /**
     * Returns the username when it names a known teacher.
     *
     * @throws ProblemException 401 {@code AUTHENTICATION_REQUIRED} otherwise
     */
    @Transactional(readOnly = true)
    public String requireTeacher(String username) {
        if (!StringUtils.hasText(username) || !teacherRepository.existsById(username)) {
            log.warn("Rejected request for unknown teacher '{}'", sanitizeForLog(username));
            throw new ProblemException(HttpStatus.UNAUTHORIZED, AUTHENTICATION_REQUIRED, "Authentication required");
        }
        return username;
    }

    static String sanitizeForLog(String value) {
        return value == null ? null : value.replaceAll("[\\r\\n\\t]", "_");
    }
}
