package com.coursetrack.domain.course;

public enum CourseStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED
}
