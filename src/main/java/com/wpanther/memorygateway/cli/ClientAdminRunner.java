package com.wpanther.memorygateway.cli;

import com.wpanther.memorygateway.dto.ClientRegistrationResponse;
import com.wpanther.memorygateway.dto.ClientSummary;
import com.wpanther.memorygateway.exception.ClientRegistrationException;
import com.wpanther.memorygateway.service.ClientRegistrationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Set;

/**
 * Out-of-band client administration:
 * <pre>
 *   oauth-generate-client --name=&lt;name&gt; [--description=&lt;text&gt;]
 *   oauth-list-clients
 *   oauth-revoke-client --client-id=&lt;id&gt;
 * </pre>
 * Does nothing when the first argument is not one of these commands.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClientAdminRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final String GENERATE_CLIENT = "oauth-generate-client";
    public static final String LIST_CLIENTS = "oauth-list-clients";
    public static final String REVOKE_CLIENT = "oauth-revoke-client";

    private static final Set<String> COMMANDS = Set.of(GENERATE_CLIENT, LIST_CLIENTS, REVOKE_CLIENT);

    private final ClientRegistrationService clientRegistrationService;

    private PrintStream out = System.out;
    private int exitCode = 0;

    public static boolean isAdminCommand(String[] args) {
        return args != null && args.length > 0 && COMMANDS.contains(args[0]);
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty() || !COMMANDS.contains(commands.get(0))) {
            return;
        }

        switch (commands.get(0)) {
            case GENERATE_CLIENT:
                generateClient(args);
                break;
            case LIST_CLIENTS:
                listClients();
                break;
            case REVOKE_CLIENT:
                revokeClient(args);
                break;
            default:
                break;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    private void generateClient(ApplicationArguments args) {
        String name = optionValue(args, "name");
        if (name == null || name.isBlank()) {
            fail("Usage: " + GENERATE_CLIENT + " --name=<name> [--description=<text>]");
            return;
        }
        try {
            ClientRegistrationResponse client = clientRegistrationService.generateClient(name,
                    optionValue(args, "description"));
            out.println("OAuth client created");
            out.println("  Client ID:     " + client.getClientId());
            out.println("  Client Secret: " + client.getClientSecret());
            out.println("  Name:          " + client.getName());
            if (!client.getDescription().isEmpty()) {
                out.println("  Description:   " + client.getDescription());
            }
            out.println();
            out.println("Save the client secret now. It cannot be shown again.");
        } catch (ClientRegistrationException e) {
            fail(e.getMessage());
        }
    }

    private void listClients() {
        List<ClientSummary> clients = clientRegistrationService.listClients();
        if (clients.isEmpty()) {
            out.println("No OAuth clients registered.");
            return;
        }
        out.println("OAuth clients (" + clients.size() + "):");
        for (ClientSummary client : clients) {
            out.println();
            out.println("  Client ID:   " + client.getClientId());
            out.println("  Name:        " + client.getName());
            if (!client.getDescription().isEmpty()) {
                out.println("  Description: " + client.getDescription());
            }
            out.println("  Created:     " + client.getCreatedAt());
            out.println("  Status:      " + (client.isRevoked() ? "revoked at " + client.getRevokedAt() : "active"));
        }
    }

    private void revokeClient(ApplicationArguments args) {
        String clientId = optionValue(args, "client-id");
        if (clientId == null || clientId.isBlank()) {
            fail("Usage: " + REVOKE_CLIENT + " --client-id=<id>");
            return;
        }
        if (clientRegistrationService.revokeClient(clientId)) {
            out.println("Revoked client " + clientId);
        } else {
            fail("Client not found: " + clientId);
        }
    }

    private void fail(String message) {
        log.error(message);
        out.println(message);
        exitCode = 1;
    }

    private static String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
