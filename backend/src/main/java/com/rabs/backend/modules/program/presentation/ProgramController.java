package com.rabs.backend.modules.program.presentation;

import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.program.application.ProgramService;
import com.rabs.backend.modules.program.presentation.dto.CreateProgramRequest;
import com.rabs.backend.modules.program.presentation.dto.ProgramResponse;
import com.rabs.backend.modules.program.presentation.dto.UpdateProgramRequest;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/programs")
public class ProgramController {

    private final ProgramService programService;

    public ProgramController(ProgramService programService) {
        this.programService = programService;
    }

    @GetMapping
    public ResponseEntity<List<ProgramResponse>> listPrograms() {
        return ResponseEntity.ok(programService.listActivePrograms());
    }

    @PostMapping
    @Operation(summary = "Create a program and materialise it inside the current window")
    public ResponseEntity<ProgramResponse> createProgram(@Valid @RequestBody CreateProgramRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(programService.createProgram(request));
    }

    @PatchMapping("/{programId}")
    @Operation(summary = "Update a program; schedule changes rebuild instances after today")
    public ResponseEntity<ProgramResponse> updateProgram(
            @PathVariable("programId") UUID programId,
            @Valid @RequestBody UpdateProgramRequest request
    ) {
        return ResponseEntity.ok(programService.updateProgram(programId, request));
    }

    @PostMapping("/{programId}/deactivation")
    public ResponseEntity<ProgramResponse> deactivateProgram(@PathVariable("programId") UUID programId) {
        return ResponseEntity.ok(programService.deactivateProgram(programId));
    }
}
