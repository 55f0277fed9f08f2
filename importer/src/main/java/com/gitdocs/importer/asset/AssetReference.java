package com.gitdocs.importer.asset;

import java.nio.file.Path;

/**
 * @param original reference as written in the document
 * @param remotePath the reference resolved against the document's remote directory
 * @param localFile where the asset bytes are stored
 * @param localUrl what the reference is rewritten to
 */
public record AssetReference(String original, String remotePath, Path localFile, String localUrl) {}
