package com.errorengine.util;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class JdbcConnectionInfo {
    private String url;
    private String username;
    private String password;
    private String dbType;
    private String driverClassName;
    private Map<String, String> dataSourceProperties;
}
