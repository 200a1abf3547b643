package com.ocibiz.suppression.api;

import com.ocibiz.suppression.domain.EmailSuppressionService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Suppression list endpoints.
 *
 * <p>Addresses are taken verbatim from the path; failures are rendered by {@link
 * com.ocibiz.suppression.infrastructure.web.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/email-suppression")
public class EmailSuppressionController {

    private final EmailSuppressionService service;

    public EmailSuppressionController(EmailSuppressionService service) {
        this.service = service;
    }

    @GetMapping("/{email}")
    public CheckSuppressionResponse check(@PathVariable("email") String email) {
        return CheckSuppressionResponse.from(service.check(email));
    }

    @DeleteMapping("/{email}")
    public RemoveSuppressionResponse remove(@PathVariable("email") String email) {
        return RemoveSuppressionResponse.from(service.remove(email));
    }
}
