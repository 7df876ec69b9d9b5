package com.panda.stackdeployer.feature.stack.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.panda.stackdeployer.feature.stack.application.GetStackOperationResultService;
import com.panda.stackdeployer.feature.stack.application.StartStackOperationService;
import com.panda.stackdeployer.feature.stack.application.StreamStackEventsService;
import com.panda.stackdeployer.feature.stack.dto.StackDeployRequest;
import com.panda.stackdeployer.feature.stack.dto.StackDestroyRequest;
import com.panda.stackdeployer.feature.stack.dto.StackOperationResponse;
import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import com.panda.stackdeployer.feature.stack.exception.MissingEnvironmentException;
import com.panda.stackdeployer.feature.stack.exception.StackOperationInProgressException;
import com.panda.stackdeployer.global.exception.GlobalExceptionHandler;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.cloudformation.model.CloudFormationException;

@ExtendWith(MockitoExtension.class)
class StackControllerTest {

    @Mock
    private StartStackOperationService startStackOperationService;

    @Mock
    private GetStackOperationResultService getStackOperationResultService;

    @Mock
    private StreamStackEventsService streamStackEventsService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        StackController controller = new StackController(startStackOperationService, getStackOperationResultService,
                streamStackEventsService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST deploy returns the operation id")
    void deploy() throws Exception {
        when(startStackOperationService.deploy(any(StackDeployRequest.class)))
                .thenReturn(new StackOperationResponse("op_1a2b3c4d5e", "demo", "Operation started"));

        mockMvc.perform(post("/api/v1/stacks/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stackName\":\"demo\",\"account\":\"123456789012\",\"region\":\"us-east-1\","
                                + "\"template\":{\"Resources\":{}},"
                                + "\"metadata\":{\"/demo/Bucket/Resource\":"
                                + "[{\"type\":\"aws:cdk:logicalId\",\"data\":\"Bucket\"}]}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.operationId").value("op_1a2b3c4d5e"))
                .andExpect(jsonPath("$.data.deployName").value("demo"));
    }

    @Test
    @DisplayName("POST deploy without an environment is a bad request")
    void deployWithoutEnvironment() throws Exception {
        when(startStackOperationService.deploy(any(StackDeployRequest.class)))
                .thenThrow(new MissingEnvironmentException("demo"));

        mockMvc.perform(post("/api/v1/stacks/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stackName\":\"demo\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("CONFIGURATION_ERROR"))
                .andExpect(jsonPath("$.stackName").value("demo"))
                .andExpect(jsonPath("$.message").value("The stack demo does not have an environment"));
    }

    @Test
    @DisplayName("POST destroy on a stack with an operation running is a conflict")
    void destroyWhileRunning() throws Exception {
        when(startStackOperationService.destroy(any(StackDestroyRequest.class)))
                .thenThrow(new StackOperationInProgressException("demo", "op_1a2b3c4d5e"));

        mockMvc.perform(post("/api/v1/stacks/destroy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stackName\":\"demo\",\"account\":\"123456789012\",\"region\":\"us-east-1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("OPERATION_IN_PROGRESS"))
                .andExpect(jsonPath("$.stackName").value("demo"));
    }

    @Test
    @DisplayName("POST destroy returns the operation id")
    void destroy() throws Exception {
        when(startStackOperationService.destroy(any(StackDestroyRequest.class)))
                .thenReturn(new StackOperationResponse("op_1", "demo", "Operation started"));

        mockMvc.perform(post("/api/v1/stacks/destroy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stackName\":\"demo\",\"account\":\"123456789012\",\"region\":\"us-east-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.operationId").value("op_1"));
    }

    @Test
    @DisplayName("GET operation returns its result")
    void getResult() throws Exception {
        when(getStackOperationResultService.getResult("op_1")).thenReturn(StackOperationResult.builder()
                .operationId("op_1")
                .deployName("demo")
                .status(StackOperationResult.SUCCEEDED)
                .outputs(Map.of("Url", "https://demo"))
                .build());

        mockMvc.perform(get("/api/v1/stacks/operations/op_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("SUCCEEDED"))
                .andExpect(jsonPath("$.data.outputs.Url").value("https://demo"));
    }

    @Test
    @DisplayName("GET unknown operation is a bad request")
    void unknownOperation() throws Exception {
        when(getStackOperationResultService.getResult("op_x"))
                .thenThrow(new IllegalArgumentException("No stack operation found: op_x"));

        mockMvc.perform(get("/api/v1/stacks/operations/op_x"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No stack operation found: op_x"));
    }

    @Test
    @DisplayName("CloudFormation errors surface as bad gateway")
    void awsErrorIsBadGateway() throws Exception {
        when(startStackOperationService.destroy(any(StackDestroyRequest.class)))
                .thenThrow(CloudFormationException.builder()
                        .message("Access denied")
                        .awsErrorDetails(AwsErrorDetails.builder().errorCode("AccessDenied").build())
                        .statusCode(403)
                        .build());

        mockMvc.perform(post("/api/v1/stacks/destroy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stackName\":\"demo\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorCode").value("REMOTE_API_ERROR"))
                .andExpect(jsonPath("$.awsErrorCode").value("AccessDenied"));
    }
}
