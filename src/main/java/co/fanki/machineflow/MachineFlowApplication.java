package co.fanki.machineflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Machine Flow Engine Application.
 *
 * <p>Hosts the machine registry and the execution runs behind a REST API.
 * Machines are loaded as JSON, validated statically and then executed by
 * one engine per run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
@EnableScheduling
public class MachineFlowApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(MachineFlowApplication.class, args);
    }

}
