package authzen.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * AuthZEN PDP metadata served at {@code /.well-known/authzen-configuration}.
 */
public record WellKnownConfigurationDto(
        @JsonProperty("policy_decision_point") String policyDecisionPoint,
        @JsonProperty("access_evaluation_endpoint") String accessEvaluationEndpoint,
        @JsonProperty("access_evaluations_endpoint") String accessEvaluationsEndpoint,
        @JsonProperty("search_subject_endpoint") String searchSubjectEndpoint,
        @JsonProperty("search_action_endpoint") String searchActionEndpoint,
        @JsonProperty("search_resource_endpoint") String searchResourceEndpoint) {

    public static WellKnownConfigurationDto forBaseUrl(String baseUrl) {
        return new WellKnownConfigurationDto(
                baseUrl,
                baseUrl + "/access/v1/evaluation",
                baseUrl + "/access/v1/evaluations",
                baseUrl + "/access/v1/search/subject",
                baseUrl + "/access/v1/search/action",
                baseUrl + "/access/v1/search/resource");
    }
}
