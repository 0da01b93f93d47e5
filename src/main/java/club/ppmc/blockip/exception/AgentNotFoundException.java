package club.ppmc.blockip.exception;

import org.springframework.http.HttpStatus;

public class AgentNotFoundException extends BlockIpException {

    private final String agent;

    public AgentNotFoundException(String agent) {
        super(HttpStatus.NOT_FOUND, "agent_not_found", "Bot type not found: " + agent);
        this.agent = agent;
    }

    public String getAgent() {
        return agent;
    }
}
