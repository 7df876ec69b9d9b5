package com.panda.stackdeployer.feature.stack.api;

import com.panda.stackdeployer.feature.stack.application.GetStackOperationResultService;
import com.panda.stackdeployer.feature.stack.application.StartStackOperationService;
import com.panda.stackdeployer.feature.stack.application.StreamStackEventsService;
import com.panda.stackdeployer.feature.stack.dto.StackDeployRequest;
import com.panda.stackdeployer.feature.stack.dto.StackDestroyRequest;
import com.panda.stackdeployer.feature.stack.dto.StackOperationResponse;
import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import com.panda.stackdeployer.global.response.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Slf4j
@RestController
@RequiredArgsConstructor
public class StackController implements StackApi {

    private final StartStackOperationService startStackOperationService;
    private final GetStackOperationResultService getStackOperationResultService;
    private final StreamStackEventsService streamStackEventsService;

    @Override
    @PostMapping("/api/v1/stacks/deploy")
    public ApiResponse<StackOperationResponse> deploy(@RequestBody StackDeployRequest request) {
        StackOperationResponse response = startStackOperationService.deploy(request);
        return ApiResponse.success("Stack deployment started", response);
    }

    @Override
    @PostMapping("/api/v1/stacks/destroy")
    public ApiResponse<StackOperationResponse> destroy(@RequestBody StackDestroyRequest request) {
        StackOperationResponse response = startStackOperationService.destroy(request);
        return ApiResponse.success("Stack destroy started", response);
    }

    @Override
    @GetMapping("/api/v1/stacks/operations/{operationId}")
    public ApiResponse<StackOperationResult> getResult(@PathVariable String operationId) {
        StackOperationResult result = getStackOperationResultService.getResult(operationId);
        return ApiResponse.success("Stack operation result", result);
    }

    @Override
    @GetMapping(value = "/api/v1/stacks/operations/{operationId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String operationId) {
        log.info("SSE client connected for operation: {}", operationId);
        return streamStackEventsService.stream(operationId);
    }
}
