package com.openrangelabs.ingestor.dto;

import com.openrangelabs.ingestor.connector.ConnectionParameter;
import com.openrangelabs.ingestor.connector.ConnectorCapabilities;
import com.openrangelabs.ingestor.connector.ConnectorMetadata;
import com.openrangelabs.ingestor.connector.DataSourceConnector;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.util.List;

@Value
@Schema(description = "Connector self-description: metadata, capabilities and accepted parameters")
public class ConnectorDetailsDto {

    ConnectorMetadata metadata;
    ConnectorCapabilities capabilities;
    List<ConnectionParameter> parameters;

    public static ConnectorDetailsDto describe(DataSourceConnector connector) {
        return new ConnectorDetailsDto(connector.describeMetadata(), connector.getCapabilities(),
                connector.describeParameters());
    }
}
