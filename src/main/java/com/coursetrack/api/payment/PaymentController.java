package com.coursetrack.api.payment;

import com.coursetrack.api.auth.AuthenticatedLearner;
import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.payment.dtos.PaymentDtos;
import com.coursetrack.service.payment.PaymentService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping("/{id}/confirm")
    public PaymentDtos.Response confirm(@AuthenticatedLearner LearnerPrincipal principal,
                                        @PathVariable Long id) {
        return PaymentDtos.Response.from(paymentService.confirm(principal, id));
    }

    @PostMapping("/{id}/fail")
    public PaymentDtos.Response fail(@AuthenticatedLearner LearnerPrincipal principal,
                                     @PathVariable Long id) {
        return PaymentDtos.Response.from(paymentService.fail(principal, id));
    }
}
