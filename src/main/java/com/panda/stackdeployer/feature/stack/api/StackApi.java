package com.panda.stackdeployer.feature.stack.api;

import com.panda.stackdeployer.feature.stack.dto.StackDeployRequest;
import com.panda.stackdeployer.feature.stack.dto.StackDestroyRequest;
import com.panda.stackdeployer.feature.stack.dto.StackOperationResponse;
import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import com.panda.stackdeployer.global.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Tag(name = "Stack", description = "CloudFormation stack deploy and destroy")
public interface StackApi {

    @PostMapping("/api/v1/stacks/deploy")
    @Operation(
        summary = "Deploy a stack",
        description = "Creates or updates the stack through a change set. " +
                     "Returns an operationId immediately and deploys in the background."
    )
    ApiResponse<StackOperationResponse> deploy(@RequestBody StackDeployRequest request);

    @PostMapping("/api/v1/stacks/destroy")
    @Operation(
        summary = "Destroy a stack",
        description = "Deletes the stack if it exists and waits for the deletion to finish in the background."
    )
    ApiResponse<StackOperationResponse> destroy(@RequestBody StackDestroyRequest request);

    @GetMapping("/api/v1/stacks/operations/{operationId}")
    @Operation(
        summary = "Get operation result",
        description = "Returns the current status of a deploy or destroy operation, " +
                     "including stack outputs once the deployment has completed."
    )
    ApiResponse<StackOperationResult> getResult(@PathVariable String operationId);

    @GetMapping(value = "/api/v1/stacks/operations/{operationId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(
        summary = "Stream stack activity (SSE)",
        description = "Streams stack events as they happen. " +
                     "Events already published are replayed first so late subscribers see the whole operation."
    )
    SseEmitter streamEvents(@PathVariable String operationId);
}
