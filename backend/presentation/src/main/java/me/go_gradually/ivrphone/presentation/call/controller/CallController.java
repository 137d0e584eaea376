package me.go_gradually.ivrphone.presentation.call.controller;

import me.go_gradually.ivrphone.application.call.model.CallSnapshot;
import me.go_gradually.ivrphone.application.call.usecase.ActiveCallUseCase;
import me.go_gradually.ivrphone.presentation.call.dto.CallResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/calls")
public class CallController {
    private final ActiveCallUseCase activeCallUseCase;

    public CallController(ActiveCallUseCase activeCallUseCase) {
        this.activeCallUseCase = activeCallUseCase;
    }

    @GetMapping
    public List<CallResponse> list() {
        return activeCallUseCase.list().stream().map(this::toResponse).toList();
    }

    @GetMapping("/{callId}")
    public CallResponse get(@PathVariable String callId) {
        return toResponse(activeCallUseCase.get(callId));
    }

    @DeleteMapping("/{callId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void hangup(@PathVariable String callId) {
        activeCallUseCase.hangup(callId);
    }

    private CallResponse toResponse(CallSnapshot snapshot) {
        CallResponse response = new CallResponse();
        response.setCallId(snapshot.callId());
        response.setPhase(snapshot.phase());
        response.setStartedAt(snapshot.startedAt());
        return response;
    }
}
