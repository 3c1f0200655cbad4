package com.llmcommittee.service;

import com.llmcommittee.config.BackendProviderProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class ConfiguredBackendLabelResolver implements BackendLabelResolver {

    private final BackendProviderProperties backendProviderProperties;

    @Override
    public String labelFor(String backendId) {
        if (backendId == null) {
            return null;
        }
        Map<String, String> labels = backendProviderProperties.getLabels();
        String label = labels == null ? null : labels.get(backendId);
        return label == null || label.isBlank() ? backendId : label;
    }
}
