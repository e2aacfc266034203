package com.coursetrack.service.course;

import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.course.dtos.CourseDtos;
import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.course.Course;
import com.coursetrack.domain.course.CourseModule;
import com.coursetrack.domain.course.CourseModuleRepository;
import com.coursetrack.domain.course.CourseStatus;
import com.coursetrack.domain.course.Lesson;
import com.coursetrack.domain.course.LessonRepository;
import com.coursetrack.domain.course.LessonType;
import com.coursetrack.domain.learner.LearnerRole;
import com.coursetrack.domain.tenant.Tenant;
import com.coursetrack.support.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestDataFactory.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_EACH_TEST_METHOD)
class CourseServiceTest {

    @Autowired
    private CourseService courseService;

    @Autowired
    private CourseModuleRepository courseModuleRepository;

    @Autowired
    private LessonRepository lessonRepository;

    @Autowired
    private TestDataFactory factory;

    private Tenant tenant;
    private LearnerPrincipal instructor;
    private LearnerPrincipal learner;

    @BeforeEach
    void setUp() {
        tenant = factory.tenant();
        instructor = factory.principal(factory.learner(tenant, LearnerRole.INSTRUCTOR));
        learner = factory.principal(factory.learner(tenant, LearnerRole.LEARNER));
    }

    private Course createCourse() {
        return courseService.create(instructor,
                new CourseDtos.CreateRequest("자료구조", "기초 과정", BigDecimal.ZERO, null, null));
    }

    @Test
    @DisplayName("강좌는 DRAFT 상태로 생성되고 통화 기본값은 USD")
    void create_draft() {
        Course course = createCourse();

        assertThat(course.getId()).isNotNull();
        assertThat(course.getStatus()).isEqualTo(CourseStatus.DRAFT);
        assertThat(course.getCurrency()).isEqualTo("USD");
        assertThat(course.isFree()).isTrue();
    }

    @Test
    @DisplayName("학습자는 강좌를 만들 수 없다")
    void create_forbiddenForLearner() {
        assertThatThrownBy(() -> courseService.create(learner,
                new CourseDtos.CreateRequest("자료구조", null, BigDecimal.ZERO, null, null)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.FORBIDDEN));
    }

    @Test
    @DisplayName("순서를 지정하지 않으면 마지막 다음 번호가 매겨진다")
    void addModuleAndLesson_autoOrder() {
        Course course = createCourse();

        CourseModule first = courseService.addModule(instructor, course.getId(), new CourseDtos.ModuleRequest("1장", null));
        CourseModule second = courseService.addModule(instructor, course.getId(), new CourseDtos.ModuleRequest("2장", null));
        Lesson lesson1 = courseService.addLesson(instructor, first.getId(),
                new CourseDtos.LessonRequest("소개", LessonType.VIDEO, 300, null, null));
        Lesson lesson2 = courseService.addLesson(instructor, first.getId(),
                new CourseDtos.LessonRequest("정리", LessonType.TEXT, null, null, false));

        assertThat(first.getOrderIndex()).isEqualTo(1);
        assertThat(second.getOrderIndex()).isEqualTo(2);
        assertThat(lesson1.getOrderIndex()).isEqualTo(1);
        assertThat(lesson1.isMandatory()).isTrue();
        assertThat(lesson2.getOrderIndex()).isEqualTo(2);
        assertThat(lesson2.isMandatory()).isFalse();
        assertThat(lesson2.getDurationSeconds()).isNull();
    }

    @Test
    @DisplayName("같은 순서 번호를 지정하면 DUPLICATE_ORDER 예외")
    void addModule_duplicateOrder() {
        Course course = createCourse();
        CourseModule module = courseService.addModule(instructor, course.getId(), new CourseDtos.ModuleRequest("1장", 1));

        assertThatThrownBy(() -> courseService.addModule(instructor, course.getId(), new CourseDtos.ModuleRequest("중복", 1)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DUPLICATE_ORDER));

        courseService.addLesson(instructor, module.getId(),
                new CourseDtos.LessonRequest("레슨", LessonType.VIDEO, 60, 3, true));
        assertThatThrownBy(() -> courseService.addLesson(instructor, module.getId(),
                new CourseDtos.LessonRequest("중복", LessonType.VIDEO, 60, 3, true)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DUPLICATE_ORDER));
    }

    @Test
    @DisplayName("순서 번호 조회는 같은 테넌트의 모듈/레슨만 본다")
    void orderIndexLookups_scopedByTenant() {
        Course course = createCourse();
        CourseModule module = courseService.addModule(instructor, course.getId(), new CourseDtos.ModuleRequest("1장", 4));
        courseService.addLesson(instructor, module.getId(), new CourseDtos.LessonRequest("레슨", LessonType.VIDEO, 60, 7, true));
        Long otherTenantId = factory.tenant().getId();

        assertThat(courseModuleRepository.findMaxOrderIndex(tenant.getId(), course.getId())).isEqualTo(4);
        assertThat(courseModuleRepository.findMaxOrderIndex(otherTenantId, course.getId())).isZero();
        assertThat(courseModuleRepository.existsByTenantIdAndCourseIdAndOrderIndex(tenant.getId(), course.getId(), 4)).isTrue();
        assertThat(courseModuleRepository.existsByTenantIdAndCourseIdAndOrderIndex(otherTenantId, course.getId(), 4)).isFalse();

        assertThat(lessonRepository.findMaxOrderIndex(tenant.getId(), module.getId())).isEqualTo(7);
        assertThat(lessonRepository.findMaxOrderIndex(otherTenantId, module.getId())).isZero();
        assertThat(lessonRepository.existsByTenantIdAndModuleIdAndOrderIndex(tenant.getId(), module.getId(), 7)).isTrue();
        assertThat(lessonRepository.existsByTenantIdAndModuleIdAndOrderIndex(otherTenantId, module.getId(), 7)).isFalse();
    }

    @Test
    @DisplayName("학습자 카탈로그에는 공개 강좌만 보인다")
    void findCatalog_learnerSeesPublishedOnly() {
        Course draft = createCourse();
        Course published = createCourse();
        courseService.publish(instructor, published.getId());

        assertThat(courseService.findCatalog(learner))
                .extracting(Course::getId)
                .containsExactly(published.getId());
        assertThat(courseService.findCatalog(instructor))
                .extracting(Course::getId)
                .containsExactlyInAnyOrder(draft.getId(), published.getId());
    }

    @Test
    @DisplayName("목차는 모듈/레슨 순서대로 내려가고 필수 레슨 수를 포함한다")
    void getOutline_ordered() {
        Course course = createCourse();
        CourseModule second = courseService.addModule(instructor, course.getId(), new CourseDtos.ModuleRequest("2장", 2));
        CourseModule first = courseService.addModule(instructor, course.getId(), new CourseDtos.ModuleRequest("1장", 1));
        courseService.addLesson(instructor, first.getId(), new CourseDtos.LessonRequest("B", LessonType.VIDEO, 60, 2, true));
        courseService.addLesson(instructor, first.getId(), new CourseDtos.LessonRequest("A", LessonType.VIDEO, 60, 1, true));
        courseService.addLesson(instructor, second.getId(), new CourseDtos.LessonRequest("퀴즈", LessonType.QUIZ, null, 1, false));
        courseService.publish(instructor, course.getId());

        CourseDtos.Outline outline = courseService.getOutline(learner, course.getId());

        assertThat(outline.modules()).extracting(CourseDtos.ModuleOutline::title).containsExactly("1장", "2장");
        assertThat(outline.modules().get(0).lessons()).extracting(CourseDtos.LessonOutline::title).containsExactly("A", "B");
        assertThat(outline.totalLessons()).isEqualTo(3);
        assertThat(outline.mandatoryLessons()).isEqualTo(2);
    }

    @Test
    @DisplayName("학습자는 비공개 강좌 목차를 볼 수 없다")
    void getOutline_draftHiddenFromLearner() {
        Course draft = createCourse();

        assertThatThrownBy(() -> courseService.getOutline(learner, draft.getId()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.COURSE_NOT_FOUND));
        assertThat(courseService.getOutline(instructor, draft.getId()).status()).isEqualTo(CourseStatus.DRAFT);
    }

    @Test
    @DisplayName("보관된 강좌는 다시 공개할 수 없다")
    void publish_archived() {
        Course course = createCourse();
        courseService.publish(instructor, course.getId());
        Course archived = courseService.archive(instructor, course.getId());
        assertThat(archived.getStatus()).isEqualTo(CourseStatus.ARCHIVED);

        assertThatThrownBy(() -> courseService.publish(instructor, course.getId()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_COURSE_STATE));
    }
}
