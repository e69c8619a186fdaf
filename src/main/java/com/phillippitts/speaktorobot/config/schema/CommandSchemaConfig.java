package com.phillippitts.speaktorobot.config.schema;

import com.phillippitts.speaktorobot.config.properties.CommandSchemaProperties;
import com.phillippitts.speaktorobot.service.schema.CommandSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the command schema from {@code robot.schema.*} properties.
 */
@Configuration
public class CommandSchemaConfig {

    private static final Logger LOG = LogManager.getLogger(CommandSchemaConfig.class);

    @Bean
    public CommandSchema commandSchema(CommandSchemaProperties props) {
        CommandSchema schema = CommandSchema.standard(props.getCoordinateMin(), props.getCoordinateMax(),
                props.getKnownRoutes(), props.isRestrictRoutes());
        LOG.info("Command schema: commands={}, coordinates=[{}, {}], routes={} (restricted={})",
                schema.commandNames(), props.getCoordinateMin(), props.getCoordinateMax(),
                props.getKnownRoutes(), props.isRestrictRoutes());
        return schema;
    }
}
