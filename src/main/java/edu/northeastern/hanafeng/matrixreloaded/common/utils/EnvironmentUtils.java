package edu.northeastern.hanafeng.matrixreloaded.common.utils;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Identity of the machine generating the load, stamped on reports and metrics.
 */
@Getter
@Component
@Slf4j
public class EnvironmentUtils {

    private final String hostname;

    public EnvironmentUtils() {
        this.hostname = resolveHostname();
    }

    private String resolveHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Failed to get hostname, using 'unknown'", e);
            return "unknown";
        }
    }
}
