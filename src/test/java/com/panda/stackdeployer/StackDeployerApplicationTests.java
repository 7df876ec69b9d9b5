package com.panda.stackdeployer;

import static org.assertj.core.api.Assertions.assertThat;

import com.panda.stackdeployer.feature.stack.api.StackController;
import com.panda.stackdeployer.feature.stack.application.StackDeployer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "aws.credentials.access-key-id=AKIDEXAMPLE",
        "aws.credentials.secret-access-key=secret"
})
class StackDeployerApplicationTests {

    @Autowired
    private StackController stackController;

    @Autowired
    private StackDeployer stackDeployer;

    @Test
    void contextLoads() {
        assertThat(stackController).isNotNull();
        assertThat(stackDeployer).isNotNull();
    }
}
