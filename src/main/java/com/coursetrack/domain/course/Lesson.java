package com.coursetrack.domain.course;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "lessons",
        uniqueConstraints = @UniqueConstraint(columnNames = {"module_id", "order_index"}),
        indexes = @Index(name = "idx_lesson_tenant_id", columnList = "tenant_id"))
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Lesson {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "module_id", nullable = false)
    private CourseModule module;

    @Column(nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LessonType type;

    // 동영상 레슨만 값이 있음 (초)
    private Integer durationSeconds;

    @Column(name = "order_index", nullable = false)
    private Integer orderIndex;

    @Column(nullable = false)
    private boolean mandatory;

    public Long getCourseId() {
        return module.getCourse().getId();
    }

    public boolean exceedsDuration(int positionSeconds) {
        return durationSeconds != null && positionSeconds > durationSeconds;
    }
}
