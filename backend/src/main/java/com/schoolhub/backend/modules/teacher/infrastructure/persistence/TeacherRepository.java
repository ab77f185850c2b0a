package com.schoolhub.backend.modules.teacher.infrastructure.persistence;

import com.schoolhub.backend.modules.teacher.domain.Teacher;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TeacherRepository extends JpaRepository<Teacher, String> {
}
