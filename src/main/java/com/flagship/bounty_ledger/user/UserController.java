package com.flagship.bounty_ledger.user;

import com.flagship.bounty_ledger.payment.PaymentService;
import com.flagship.bounty_ledger.payment.dto.PaymentResponse;
import com.flagship.bounty_ledger.submission.SubmissionService;
import com.flagship.bounty_ledger.submission.dto.SubmissionResponse;
import com.flagship.bounty_ledger.user.dto.LoginRequest;
import com.flagship.bounty_ledger.user.dto.RegisterUserRequest;
import com.flagship.bounty_ledger.user.dto.UpdateWalletRequest;
import com.flagship.bounty_ledger.user.dto.UserResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final SubmissionService submissionService;
    private final PaymentService paymentService;

    @PostMapping
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterUserRequest request) {
        User user = userService.register(request.getUsername(), request.getPassword(), request.getWalletAddress());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    @PostMapping("/login")
    public UserResponse login(@Valid @RequestBody LoginRequest request) {
        return UserResponse.from(userService.login(request.getUsername(), request.getPassword()));
    }

    @GetMapping("/{id}")
    public UserResponse getUser(@PathVariable("id") UUID id) {
        return UserResponse.from(userService.getUser(id));
    }

    @PutMapping("/{id}/wallet")
    public UserResponse setWallet(@PathVariable("id") UUID id, @Valid @RequestBody UpdateWalletRequest request) {
        return UserResponse.from(userService.setPayoutAddress(id, request.getWalletAddress()));
    }

    @GetMapping("/{id}/submissions")
    public List<SubmissionResponse> listSubmissions(@PathVariable("id") UUID id) {
        return submissionService.listForWorker(id).stream().map(SubmissionResponse::from).toList();
    }

    @GetMapping("/{id}/payments")
    public List<PaymentResponse> listPayments(@PathVariable("id") UUID id) {
        return paymentService.listForWorker(id).stream().map(PaymentResponse::from).toList();
    }
}
