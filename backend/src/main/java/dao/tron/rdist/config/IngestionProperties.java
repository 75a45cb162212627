package dao.tron.rdist.config;

import dao.tron.rdist.ingest.LateEventPolicy;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@Validated
@ConfigurationProperties(prefix = "ingestion")
@Data
public class IngestionProperties {

    /**
     * What to do with a participation event whose epoch is already sealed.
     * Required, no default.
     */
    @NotNull
    private LateEventPolicy lateEventPolicy;

    /**
     * Late events kept for inspection under {@link LateEventPolicy#FLAG}.
     */
    private int flaggedRetention = 10_000;
}
