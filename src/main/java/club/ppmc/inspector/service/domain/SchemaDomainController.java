/**
 * SchemaDomainController.java
 *
 * Schema 域：查询被调试进程支持的协议域及其版本。
 */
package club.ppmc.inspector.service.domain;

import club.ppmc.inspector.service.EventDispatcher;
import club.ppmc.inspector.service.RequestCorrelator;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Service;

@Service
public class SchemaDomainController extends AbstractDomainController {

    public enum Command implements DomainMethod {
        GET_DOMAINS
    }

    /** 一个协议域的名称与版本。 */
    public record Domain(String name, String version) {}

    public SchemaDomainController(RequestCorrelator correlator, EventDispatcher dispatcher, Gson gson) {
        super("Schema", correlator, dispatcher, gson);
    }

    public CompletableFuture<List<Domain>> getDomains() {
        return send(Command.GET_DOMAINS).thenApply(result -> {
            List<Domain> domains = new ArrayList<>();
            if (result.has("domains")) {
                for (JsonElement element : result.getAsJsonArray("domains")) {
                    domains.add(gson.fromJson(element, Domain.class));
                }
            }
            return domains;
        });
    }
}
