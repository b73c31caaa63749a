package com.mainforce.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:postgresql://localhost:5432/mainforce";
    private String user = "mainforce";
    private String pass = "mainforce";
    private String schema = "mainforce";
}
