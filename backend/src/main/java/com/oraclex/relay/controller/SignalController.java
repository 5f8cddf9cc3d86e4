package com.oraclex.relay.controller;

import com.oraclex.relay.dto.ApproveSignalRequest;
import com.oraclex.relay.dto.ApproveSignalResponse;
import com.oraclex.relay.dto.FlushResponse;
import com.oraclex.relay.dto.PendingApprovalsResponse;
import com.oraclex.relay.dto.PendingSignalSummary;
import com.oraclex.relay.dto.ReceiptAckResponse;
import com.oraclex.relay.dto.SubmitSignalResponse;
import com.oraclex.relay.model.ExecutionReceipt;
import com.oraclex.relay.model.QueuedCommand;
import com.oraclex.relay.model.TradeSignal;
import com.oraclex.relay.service.ApprovalWorkflow;
import com.oraclex.relay.service.CommandQueue;
import com.oraclex.relay.service.ReceiptLog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Tag(name = "Signals")
public class SignalController {

    private final ApprovalWorkflow approvalWorkflow;
    private final CommandQueue commandQueue;
    private final ReceiptLog receiptLog;

    @PostMapping("/submit-signal")
    @Operation(summary = "Submit a trade signal for approval")
    public ResponseEntity<SubmitSignalResponse> submitSignal(@RequestBody TradeSignal signal) {
        return ResponseEntity.ok(approvalWorkflow.submit(signal));
    }

    @PostMapping("/approve-signal")
    @Operation(summary = "Approve a pending signal and queue it for execution")
    public ResponseEntity<ApproveSignalResponse> approveSignal(@RequestBody ApproveSignalRequest request) {
        QueuedCommand command = approvalWorkflow.approve(request.getCmdId(), request.getLot());
        return ResponseEntity.ok(ApproveSignalResponse.builder()
                .ok(true)
                .approved(true)
                .cmdId(command.getCmdId())
                .lot(command.getLot())
                .build());
    }

    @GetMapping("/pending-approvals")
    @Operation(summary = "Signals awaiting approval or execution")
    public ResponseEntity<PendingApprovalsResponse> pendingApprovals() {
        List<PendingSignalSummary> items = approvalWorkflow.listPending();
        return ResponseEntity.ok(PendingApprovalsResponse.builder()
                .total(items.size())
                .items(items)
                .build());
    }

    @GetMapping("/last-signal")
    @Operation(summary = "Take the next queued command, or NONE")
    public ResponseEntity<QueuedCommand> lastSignal() {
        return ResponseEntity.ok(commandQueue.popNext());
    }

    @PostMapping("/execution-receipt")
    @Operation(summary = "Record an execution outcome")
    public ResponseEntity<ReceiptAckResponse> executionReceipt(@RequestBody(required = false) ExecutionReceipt receipt) {
        return ResponseEntity.ok(receiptLog.record(receipt));
    }

    @GetMapping("/execution-receipts")
    @Operation(summary = "Most recent execution receipts, newest first")
    public ResponseEntity<List<ExecutionReceipt>> recentReceipts(
            @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(receiptLog.recent(limit));
    }

    @PostMapping("/flush-queue")
    @Operation(summary = "Drop every queued command")
    public ResponseEntity<FlushResponse> flushQueue() {
        int cleared = commandQueue.flush();
        return ResponseEntity.ok(FlushResponse.builder()
                .status(FlushResponse.FLUSHED)
                .ok(true)
                .cleared(cleared)
                .build());
    }
}
