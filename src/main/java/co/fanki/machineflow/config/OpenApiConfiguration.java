package co.fanki.machineflow.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Machine Flow Engine.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI description.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Machine Flow Engine API")
                        .description("""
                                Machine Flow Engine - loads machine graphs, checks their
                                structure and runs them as sets of execution paths.

                                ## Machines
                                - **Register**: load a machine from its JSON form
                                - **Validation**: unreachable/orphaned nodes, cycles, entry and exit points
                                - **Expressions**: evaluate guards and resolve `{{ }}` templates

                                ## Runs
                                - **Step / Run**: advance every active path one transition per tick
                                - **Resume / Cancel**: wake a waiting path or stop one
                                - **State / Visualization**: snapshots for progress displays
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
