package com.coursetrack.domain.course;

public enum LessonType {
    VIDEO,
    TEXT,
    QUIZ
}
