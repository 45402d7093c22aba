package com.brewdeck.packagelist;

import com.brewdeck.domain.PackageList;
import com.brewdeck.exception.BrewDeckErrorCode;
import com.brewdeck.exception.BrewDeckException;
import com.brewdeck.utility.JacksonUtility;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads and writes package lists as pretty-printed JSON. */
public final class PackageListFile {
  public static final String DEFAULT_FILE_NAME = "brewdeck_packages.json";

  private PackageListFile() {}

  public static void write(PackageList packageList, Path target) {
    try {
      String json = JacksonUtility.getJsonMapper().writeValueAsString(packageList);
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.writeString(target, json, StandardCharsets.UTF_8);
    } catch (JsonProcessingException e) {
      throw failure("Failed to serialize package list to JSON", target, e);
    } catch (IOException e) {
      throw failure("Failed to write package list to file", target, e);
    }
  }

  public static PackageList read(Path source) {
    String json;
    try {
      json = Files.readString(source, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw failure("Failed to read package list file", source, e);
    }
    try {
      return JacksonUtility.getJsonMapper().readValue(json, PackageList.class);
    } catch (JsonProcessingException e) {
      throw failure("Failed to parse package list JSON", source, e);
    }
  }

  private static BrewDeckException failure(String message, Path path, Exception cause) {
    return new BrewDeckException(BrewDeckErrorCode.PACKAGE_LIST_ERROR, message + ": " + path, cause)
        .withContext("path", path.toString());
  }
}
