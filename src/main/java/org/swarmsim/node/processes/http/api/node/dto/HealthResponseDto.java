package org.swarmsim.node.processes.http.api.node.dto;

/**
 * Liveness response.
 *
 * @param status Always {@code "ok"} while the server answers.
 */
public record HealthResponseDto(String status) {

    public static final HealthResponseDto OK = new HealthResponseDto("ok");
}
