package com.adlanda.perema.mail;

import java.util.Map;

/**
 * A mail rendered by the provider from a stored template.
 *
 * @param to           Recipient address
 * @param templateId   Provider template id (SendGrid dynamic template)
 * @param templateData Values substituted into the template
 */
public record TemplatedMail(
        String to,
        String templateId,
        Map<String, Object> templateData
) {
    public TemplatedMail {
        templateData = Map.copyOf(templateData);
    }
}
