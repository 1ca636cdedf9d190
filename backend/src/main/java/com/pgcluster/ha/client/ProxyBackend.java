package com.pgcluster.ha.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One server row of the HAProxy stats table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyBackend {

    public static final String STATUS_UP = "UP";

    // svname is <prefix>_<address>_<port>, e.g. postgresql_192.0.2.48_5432
    private static final Pattern SERVER_NAME = Pattern.compile("^[^_]+_(.+)_(\\d+)$");

    private String proxyName;
    private String serverName;
    private String status;

    public boolean isUp() {
        return STATUS_UP.equals(status);
    }

    public Optional<String> address() {
        if (serverName == null) {
            return Optional.empty();
        }
        Matcher matcher = SERVER_NAME.matcher(serverName);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
