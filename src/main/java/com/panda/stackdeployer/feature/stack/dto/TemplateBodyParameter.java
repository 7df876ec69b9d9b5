package com.panda.stackdeployer.feature.stack.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either an inline template body or the URL of an uploaded template, never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TemplateBodyParameter {
    String templateBody;
    String templateUrl;

    public static TemplateBodyParameter inline(String templateBody) {
        return new TemplateBodyParameter(templateBody, null);
    }

    public static TemplateBodyParameter url(String templateUrl) {
        return new TemplateBodyParameter(null, templateUrl);
    }

    public boolean isUrl() {
        return templateUrl != null;
    }
}
