package com.coursetrack.service.progress;

import com.coursetrack.domain.course.LessonRepository;
import com.coursetrack.domain.enrollment.Enrollment;
import com.coursetrack.domain.progress.LessonProgressRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 필수 레슨 완료 수로 강좌 진도율을 다시 계산한다.
 * 호출자는 수강 행에 쓰기 락을 잡은 상태여야 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompletionAggregator {

    private final LessonRepository lessonRepository;
    private final LessonProgressRepository lessonProgressRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public int recompute(Enrollment enrollment, LocalDateTime now) {
        long totalMandatory = lessonRepository.countMandatoryByCourse(
                enrollment.getTenantId(), enrollment.getCourse().getId());
        long completedMandatory = lessonProgressRepository.countCompletedMandatory(
                enrollment.getTenantId(), enrollment.getId());

        int percentage = percentage(completedMandatory, totalMandatory);
        if (enrollment.applyCompletion(percentage, now)) {
            log.info("수강 완료: enrollmentId={}, learnerId={}, courseId={}",
                    enrollment.getId(), enrollment.getLearner().getId(), enrollment.getCourse().getId());
        }
        return percentage;
    }

    /**
     * 필수 레슨이 없는 강좌는 0%로 본다 (자동 완료되지 않음).
     */
    static int percentage(long completedMandatory, long totalMandatory) {
        if (totalMandatory <= 0) {
            return 0;
        }
        return (int) Math.min(100, completedMandatory * 100 / totalMandatory);
    }
}
