package com.coursetrack.api.enrollment;

import com.coursetrack.api.auth.AuthenticatedLearner;
import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.enrollment.dtos.EnrollmentDtos;
import com.coursetrack.service.enrollment.EnrollmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EnrollmentController {

    private final EnrollmentService enrollmentService;

    @GetMapping("/enrollments")
    public List<EnrollmentDtos.Response> findMine(@AuthenticatedLearner LearnerPrincipal principal) {
        return enrollmentService.findMine(principal).stream()
                .map(EnrollmentDtos.Response::from)
                .toList();
    }

    @PostMapping("/courses/{courseId}/enroll")
    @ResponseStatus(HttpStatus.CREATED)
    public EnrollmentDtos.EnrollResponse enroll(@AuthenticatedLearner LearnerPrincipal principal,
                                                @PathVariable Long courseId) {
        return EnrollmentDtos.EnrollResponse.from(enrollmentService.enroll(principal, courseId));
    }

    @PostMapping("/enrollments/{id}/withdraw")
    public EnrollmentDtos.StatusResponse withdraw(@AuthenticatedLearner LearnerPrincipal principal,
                                            @PathVariable Long id) {
        return EnrollmentDtos.StatusResponse.from(enrollmentService.withdraw(principal, id));
    }
}
