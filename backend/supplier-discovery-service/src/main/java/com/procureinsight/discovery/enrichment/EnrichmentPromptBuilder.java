package com.procureinsight.discovery.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.procureinsight.discovery.extraction.Candidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class EnrichmentPromptBuilder {

    private static final String RESPONSE_SCHEMA = """
            {
                "name": "verified company name",
                "location": "verified location",
                "confidence_score": 0.0-1.0,
                "certifications": ["list", "of", "certifications"],
                "specialties": ["list", "of", "specialties"],
                "company_size": "Small/Medium/Large/Enterprise",
                "verification_status": "verified/unverified/pending",
                "contact_info": {"email": "", "phone": "", "address": ""},
                "description": "brief company description",
                "rating": 1.0-5.0 or null
            }""";

    private final ObjectMapper objectMapper;

    public String build(Candidate candidate, EnrichmentContext context) {
        return """
                Analyze the following supplier information and provide a structured assessment:

                Supplier Data: %s
                Search Context: Product: %s, Requirements: %s

                Please provide a JSON response with the following structure:
                %s

                Focus on:
                1. Data accuracy and consistency
                2. Extracting relevant certifications (ISO, industry-specific)
                3. Determining company size indicators
                4. Assessing data reliability
                5. Identifying key specialties
                """.formatted(supplierData(candidate), context.product(), context.requirements(), RESPONSE_SCHEMA);
    }

    private String supplierData(Candidate candidate) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", candidate.getName());
        data.put("website", candidate.getWebsite());
        data.put("location", candidate.getLocation());
        data.put("description", candidate.getDescription());
        data.put("source_title", candidate.getSourceTitle());
        data.put("domain", candidate.getDomain());
        data.put("search_relevance", candidate.getSearchRelevance());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize supplier data for prompt: {}", e.getOriginalMessage());
            return data.toString();
        }
    }
}
