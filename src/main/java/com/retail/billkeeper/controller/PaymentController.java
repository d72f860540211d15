package com.retail.billkeeper.controller;

import com.retail.billkeeper.dto.PaymentResponse;
import com.retail.billkeeper.dto.RecordPaymentCommand;
import com.retail.billkeeper.dto.UpdatePaymentCommand;
import com.retail.billkeeper.service.PaymentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/payments")
public class PaymentController {

    private final PaymentService paymentService;

    public PaymentController(PaymentService paymentService) {
        this.paymentService = paymentService;
    }

    @PostMapping
    public ResponseEntity<PaymentResponse> record(@Valid @RequestBody RecordPaymentCommand command) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PaymentResponse.from(paymentService.recordPayment(command)));
    }

    @PutMapping("/{id}")
    public PaymentResponse update(@PathVariable Long id, @Valid @RequestBody UpdatePaymentCommand command) {
        return PaymentResponse.from(paymentService.updatePayment(id, command));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        paymentService.softDeletePayment(id);
        return ResponseEntity.noContent().build();
    }
}
