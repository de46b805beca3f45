package com.extsync.workspace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Contents of an extension's {@code extension.json}.
 *
 * @param handle      extension handle; defaults to the directory name
 * @param incremental whether the extension uses an incremental session; defaults to false
 * @param source      source directory relative to the extension directory; defaults to {@code src}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtensionManifest(String handle, Boolean incremental, String source) {}
