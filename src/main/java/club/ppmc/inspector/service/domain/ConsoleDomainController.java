/**
 * ConsoleDomainController.java
 *
 * Console 域的命令与事件门面。
 */
package club.ppmc.inspector.service.domain;

import club.ppmc.inspector.service.EventDispatcher;
import club.ppmc.inspector.service.RequestCorrelator;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Service;

@Service
public class ConsoleDomainController extends AbstractDomainController {

    public enum Command implements DomainMethod {
        CLEAR_MESSAGES
    }

    public enum Event implements DomainMethod {
        MESSAGE_ADDED
    }

    public ConsoleDomainController(RequestCorrelator correlator, EventDispatcher dispatcher, Gson gson) {
        super("Console", correlator, dispatcher, gson);
    }

    public CompletableFuture<JsonObject> clearMessages() {
        return send(Command.CLEAR_MESSAGES);
    }
}
