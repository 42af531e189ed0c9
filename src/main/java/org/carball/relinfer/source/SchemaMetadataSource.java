package org.carball.relinfer.source;

import org.carball.relinfer.model.candidate.LinkDescriptor;

import java.util.List;

public interface SchemaMetadataSource {

    List<LinkDescriptor> listDeclaredLinks();

    SchemaMetadataSource NONE = () -> List.of();
}
