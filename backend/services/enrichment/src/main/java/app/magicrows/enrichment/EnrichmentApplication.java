package app.magicrows.enrichment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class EnrichmentApplication {

	public static void main(String[] args) {
		SpringApplication.run(EnrichmentApplication.class, args);
	}

}
