package authzen.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Batch options.
 *
 * @param evaluationSemantics execute_all, deny_on_first_deny or permit_on_first_permit
 */
public record EvaluationOptionsDto(@JsonProperty("evaluation_semantics") String evaluationSemantics) {}
