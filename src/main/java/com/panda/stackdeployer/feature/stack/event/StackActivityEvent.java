package com.panda.stackdeployer.feature.stack.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StackActivityEvent {
    private String type;        // activity, success, fail
    private String message;
    private Map<String, Object> details;
}
