package com.coursetrack.config;

import com.coursetrack.api.auth.JwtTokenProvider;
import com.coursetrack.domain.course.Course;
import com.coursetrack.domain.course.CourseModule;
import com.coursetrack.domain.course.CourseModuleRepository;
import com.coursetrack.domain.course.CourseRepository;
import com.coursetrack.domain.course.CourseStatus;
import com.coursetrack.domain.course.Lesson;
import com.coursetrack.domain.course.LessonRepository;
import com.coursetrack.domain.course.LessonType;
import com.coursetrack.domain.learner.Learner;
import com.coursetrack.domain.learner.LearnerRepository;
import com.coursetrack.domain.learner.LearnerRole;
import com.coursetrack.domain.tenant.Tenant;
import com.coursetrack.domain.tenant.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 로컬 실행용 데모 데이터. 테넌트 하나와 강사, 학습자, 관리자, 공개 강좌 두 개를 만든다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "coursetrack.seed.enabled", havingValue = "true")
public class DataInitializer implements CommandLineRunner {

    private final TenantRepository tenantRepository;
    private final LearnerRepository learnerRepository;
    private final CourseRepository courseRepository;
    private final CourseModuleRepository courseModuleRepository;
    private final LessonRepository lessonRepository;
    private final JwtTokenProvider jwtTokenProvider;

    private static final List<String> LEARNER_NAMES = List.of("김민준", "이서연", "박도윤", "최하은", "정지호");

    @Override
    @Transactional
    public void run(String... args) {
        if (tenantRepository.existsBySubdomain("demo")) {
            return;
        }

        long startTime = System.currentTimeMillis();
        log.info("초기 데이터 생성 시작...");
        LocalDateTime now = LocalDateTime.now();

        Tenant tenant = tenantRepository.save(Tenant.builder()
                .name("데모 아카데미")
                .subdomain("demo")
                .active(true)
                .createdAt(now)
                .build());

        Learner admin = createLearner(tenant, "admin@demo.local", "관리자", LearnerRole.ADMIN, now);
        Learner instructor = createLearner(tenant, "instructor@demo.local", "강사", LearnerRole.INSTRUCTOR, now);
        Learner firstLearner = null;
        for (int i = 0; i < LEARNER_NAMES.size(); i++) {
            Learner learner = createLearner(tenant, "learner" + (i + 1) + "@demo.local",
                    LEARNER_NAMES.get(i), LearnerRole.LEARNER, now);
            if (firstLearner == null) {
                firstLearner = learner;
            }
        }

        createCourse(tenant, instructor, "Java 입문", BigDecimal.ZERO, null, now);
        createCourse(tenant, instructor, "Spring 실전", new BigDecimal("49.00"), 30, now);

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("초기 데이터 생성 완료 ({}ms)", elapsed);
        log.info("데모 토큰 (admin): {}", jwtTokenProvider.issue(admin.getId(), tenant.getId(), admin.getRole()));
        log.info("데모 토큰 (instructor): {}", jwtTokenProvider.issue(instructor.getId(), tenant.getId(), instructor.getRole()));
        log.info("데모 토큰 (learner): {}", jwtTokenProvider.issue(firstLearner.getId(), tenant.getId(), firstLearner.getRole()));
    }

    private Learner createLearner(Tenant tenant, String email, String name, LearnerRole role, LocalDateTime now) {
        return learnerRepository.save(Learner.builder()
                .tenantId(tenant.getId())
                .email(email)
                .name(name)
                .role(role)
                .createdAt(now)
                .build());
    }

    private void createCourse(Tenant tenant, Learner instructor, String title,
                              BigDecimal price, Integer maxStudents, LocalDateTime now) {
        Course course = courseRepository.save(Course.builder()
                .tenantId(tenant.getId())
                .title(title)
                .description(title + " 과정")
                .price(price)
                .currency("USD")
                .status(CourseStatus.PUBLISHED)
                .maxStudents(maxStudents)
                .instructor(instructor)
                .createdAt(now)
                .publishedAt(now)
                .build());

        for (int m = 1; m <= 2; m++) {
            CourseModule module = courseModuleRepository.save(CourseModule.builder()
                    .tenantId(tenant.getId())
                    .course(course)
                    .title(m + "장")
                    .orderIndex(m)
                    .build());

            for (int l = 1; l <= 3; l++) {
                boolean quiz = l == 3;
                lessonRepository.save(Lesson.builder()
                        .tenantId(tenant.getId())
                        .module(module)
                        .title(m + "-" + l + (quiz ? " 퀴즈" : " 강의"))
                        .type(quiz ? LessonType.QUIZ : LessonType.VIDEO)
                        .durationSeconds(quiz ? null : 600)
                        .orderIndex(l)
                        // 퀴즈는 선택 레슨
                        .mandatory(!quiz)
                        .build());
            }
        }
    }
}
