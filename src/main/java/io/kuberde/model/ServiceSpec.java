package io.kuberde.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One service exposed by a workload: a selector name, the port the workload listens on inside the
 * pod and how the relay should route to it.
 *
 * @param externalPort requested relay port for TCP services, {@code null} to let the controller pick
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceSpec(String name, int port, ServiceProtocol protocol, Integer externalPort) {
    public ServiceSpec {
        protocol = protocol == null ? ServiceProtocol.TCP : protocol;
    }

    public static ServiceSpec tcp(String name, int port) {
        return new ServiceSpec(name, port, ServiceProtocol.TCP, null);
    }

    public static ServiceSpec http(String name, int port) {
        return new ServiceSpec(name, port, ServiceProtocol.HTTP, null);
    }

    @JsonIgnore
    public boolean isHttp() {
        return protocol == ServiceProtocol.HTTP;
    }
}
