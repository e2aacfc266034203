package com.coursetrack.domain.learner;

public enum LearnerRole {
    LEARNER,
    INSTRUCTOR,
    ADMIN
}
