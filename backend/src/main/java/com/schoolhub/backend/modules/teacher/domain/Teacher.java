package com.schoolhub.backend.modules.teacher.domain;

import com.schoolhub.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Entry of the teacher directory. Only the existence of the username matters to the
 * announcement board.
 */
@Entity
@Table(name = "teacher")
public class Teacher extends AbstractTimestampedEntity {

    @Id
    @Column(name = "username", nullable = false, length = 64)
    private String username;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    protected Teacher() {
    }

    public Teacher(String username, String displayName) {
        this.username = username;
        this.displayName = displayName;
    }
}
