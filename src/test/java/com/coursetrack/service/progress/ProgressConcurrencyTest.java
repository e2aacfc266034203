package com.coursetrack.service.progress;

import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.domain.course.Course;
import com.coursetrack.domain.course.CourseModule;
import com.coursetrack.domain.course.Lesson;
import com.coursetrack.domain.enrollment.Enrollment;
import com.coursetrack.domain.enrollment.EnrollmentRepository;
import com.coursetrack.domain.enrollment.EnrollmentStatus;
import com.coursetrack.domain.learner.Learner;
import com.coursetrack.domain.learner.LearnerRole;
import com.coursetrack.domain.progress.LessonProgress;
import com.coursetrack.domain.progress.LessonProgressRepository;
import com.coursetrack.domain.tenant.Tenant;
import com.coursetrack.service.enrollment.EnrollmentService;
import com.coursetrack.support.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Import(TestDataFactory.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_EACH_TEST_METHOD)
class ProgressConcurrencyTest {

    @Autowired
    private ProgressService progressService;

    @Autowired
    private EnrollmentService enrollmentService;

    @Autowired
    private EnrollmentRepository enrollmentRepository;

    @Autowired
    private LessonProgressRepository lessonProgressRepository;

    @Autowired
    private TestDataFactory factory;

    private LearnerPrincipal learner;
    private List<Lesson> lessons;
    private Enrollment enrollment;

    @BeforeEach
    void setUp() {
        Tenant tenant = factory.tenant();
        Learner instructor = factory.learner(tenant, LearnerRole.INSTRUCTOR);
        learner = factory.principal(factory.learner(tenant, LearnerRole.LEARNER));

        Course course = factory.freeCourse(tenant, instructor);
        CourseModule module = factory.module(course, 1);
        lessons = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            lessons.add(factory.videoLesson(module, i, true));
        }

        enrollment = enrollmentService.enroll(learner, course.getId()).enrollment();
    }

    @Test
    @DisplayName("같은 레슨에 동시에 보고하면 가장 큰 진도율이 남는다")
    void concurrentReports_keepMaximum() throws InterruptedException {
        int threadCount = 20;
        Long lessonId = lessons.get(0).getId();
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch ready = new CountDownLatch(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger failCount = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            // 10, 14, ..., 86
            final int percentage = 10 + i * 4;
            executorService.submit(() -> {
                try {
                    ready.countDown();
                    start.await();
                    progressService.reportForLearner(learner, lessonId, new ProgressReport(percentage, percentage, null));
                } catch (Exception e) {
                    failCount.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }

        ready.await();
        start.countDown();
        done.await();
        executorService.shutdown();

        LessonProgress progress = lessonProgressRepository
                .findByEnrollmentAndLesson(enrollment.getTenantId(), enrollment.getId(), lessonId).orElseThrow();
        assertThat(failCount.get()).isZero();
        assertThat(progress.getCompletionPercentage()).isEqualTo(86);
        assertThat(progress.getWatchTimeSeconds()).isEqualTo(86);
        assertThat(lessonProgressRepository.findByEnrollment(enrollment.getTenantId(), enrollment.getId())).hasSize(1);
    }

    @Test
    @DisplayName("서로 다른 필수 레슨을 동시에 완료해도 수강은 정확히 100%로 완료된다")
    void concurrentCompletions_completeEnrollment() throws InterruptedException {
        int threadCount = lessons.size();
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger failCount = new AtomicInteger(0);

        for (Lesson lesson : lessons) {
            executorService.submit(() -> {
                try {
                    start.await();
                    progressService.completeForLearner(learner, lesson.getId());
                } catch (Exception e) {
                    failCount.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        done.await();
        executorService.shutdown();

        Enrollment updated = enrollmentRepository.findById(enrollment.getId()).orElseThrow();
        assertThat(failCount.get()).isZero();
        assertThat(updated.getCompletionPercentage()).isEqualTo(100);
        assertThat(updated.getStatus()).isEqualTo(EnrollmentStatus.COMPLETED);
    }
}
