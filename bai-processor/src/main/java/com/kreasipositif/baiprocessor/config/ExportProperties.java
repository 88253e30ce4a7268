package com.kreasipositif.baiprocessor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code bai.export} section from application.yml.
 * <p>
 * Constant labels stamped onto every exported transaction row.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "bai.export")
public class ExportProperties {

    /** Value of the "Account Title" column. */
    private String accountTitle = "AR Account";

    /** Value of the "Entity" column. */
    private String entityName = "";
}
