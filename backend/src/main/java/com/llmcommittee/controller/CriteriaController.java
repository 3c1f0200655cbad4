package com.llmcommittee.controller;

import com.llmcommittee.dto.CommitteeRequests;
import com.llmcommittee.model.Criteria;
import com.llmcommittee.model.CriteriaPresets;
import com.llmcommittee.service.CriteriaGenerationService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/criteria")
public class CriteriaController {

    private final CriteriaGenerationService criteriaGenerationService;

    public CriteriaController(CriteriaGenerationService criteriaGenerationService) {
        this.criteriaGenerationService = criteriaGenerationService;
    }

    @GetMapping("/presets")
    public ResponseEntity<List<Criteria>> listPresets() {
        return ResponseEntity.ok(CriteriaPresets.PRESETS);
    }

    @PostMapping("/generate")
    public ResponseEntity<Criteria> generate(@Valid @RequestBody CommitteeRequests.GenerateCriteriaRequest request) {
        return ResponseEntity.ok(criteriaGenerationService.generate(request.description(), request.backendId()));
    }
}
