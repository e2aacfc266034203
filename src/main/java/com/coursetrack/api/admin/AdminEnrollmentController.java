package com.coursetrack.api.admin;

import com.coursetrack.api.auth.AuthenticatedLearner;
import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.enrollment.dtos.EnrollmentDtos;
import com.coursetrack.service.enrollment.EnrollmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/enrollments")
@RequiredArgsConstructor
public class AdminEnrollmentController {

    private final EnrollmentService enrollmentService;

    @PostMapping("/{id}/withdraw")
    public EnrollmentDtos.StatusResponse withdraw(@AuthenticatedLearner LearnerPrincipal principal,
                                            @PathVariable Long id) {
        return EnrollmentDtos.StatusResponse.from(enrollmentService.withdrawByAdmin(principal, id));
    }
}
