package com.coursetrack.domain.course;

import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.learner.Learner;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "courses",
        indexes = @Index(name = "idx_course_tenant_status", columnList = "tenant_id, status"))
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Course {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false)
    private String title;

    @Column(length = 2000)
    private String description;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CourseStatus status;

    // null이면 정원 제한 없음
    private Integer maxStudents;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "instructor_id", nullable = false)
    private Learner instructor;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime publishedAt;

    @Builder.Default
    @OneToMany(mappedBy = "course")
    @OrderBy("orderIndex ASC")
    private List<CourseModule> modules = new ArrayList<>();

    public boolean isFree() {
        return price == null || price.signum() == 0;
    }

    public boolean isPublished() {
        return status == CourseStatus.PUBLISHED;
    }

    public void publish(LocalDateTime now) {
        if (status == CourseStatus.ARCHIVED) {
            throw new BusinessException(ErrorCode.INVALID_COURSE_STATE);
        }
        if (status != CourseStatus.PUBLISHED) {
            this.status = CourseStatus.PUBLISHED;
            this.publishedAt = now;
        }
    }

    public void archive() {
        this.status = CourseStatus.ARCHIVED;
    }
}
