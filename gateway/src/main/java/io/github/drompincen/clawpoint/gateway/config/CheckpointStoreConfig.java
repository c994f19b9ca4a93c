package io.github.drompincen.clawpoint.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawpoint.persistence.sql.JdbcSqlExecutor;
import io.github.drompincen.clawpoint.persistence.sql.SqlExecutor;
import io.github.drompincen.clawpoint.runtime.checkpoint.IncrementingVersionGenerator;
import io.github.drompincen.clawpoint.runtime.checkpoint.SqliteCheckpointSaver;
import io.github.drompincen.clawpoint.runtime.checkpoint.VersionGenerator;
import io.github.drompincen.clawpoint.runtime.serde.JacksonSerializer;
import io.github.drompincen.clawpoint.runtime.serde.SerializerProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
public class CheckpointStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStoreConfig.class);

    @Value("${clawpoint.checkpoint.url:jdbc:sqlite:clawpoint.db}")
    private String checkpointUrl;

    @Bean
    DataSource checkpointDataSource() {
        log.info("Checkpoint store at {}", checkpointUrl);
        return SqliteCheckpointSaver.dataSource(checkpointUrl);
    }

    @Bean
    SqlExecutor sqlExecutor(DataSource checkpointDataSource) {
        return new JdbcSqlExecutor(checkpointDataSource);
    }

    @Bean
    SerializerProtocol checkpointSerializer(ObjectMapper objectMapper) {
        return new JacksonSerializer(objectMapper);
    }

    @Bean
    VersionGenerator versionGenerator() {
        return new IncrementingVersionGenerator();
    }

    @Bean
    SqliteCheckpointSaver checkpointSaver(SqlExecutor sqlExecutor,
                                          SerializerProtocol checkpointSerializer,
                                          VersionGenerator versionGenerator) {
        return new SqliteCheckpointSaver(sqlExecutor, checkpointSerializer, versionGenerator);
    }
}
