package com.brewdeck.tasks;

import com.brewdeck.domain.PackageList;
import com.brewdeck.packagelist.PackageListFile;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Installs every package listed in a previously exported file. Callers usually follow a successful
 * import with {@link LoadInstalled}.
 */
public record ImportPackages(Path file) implements SingletonTask<List<String>> {
  public ImportPackages {
    Objects.requireNonNull(file, "file");
  }

  @Override
  public TaskKind kind() {
    return TaskKind.IMPORT_PACKAGES;
  }

  @Override
  public String describe() {
    return "importing packages from " + file;
  }

  @Override
  public TaskOutcome<List<String>> run(TaskContext ctx) throws InterruptedException {
    PackageList packageList = PackageListFile.read(file);
    List<String> installed = ctx.packageLists().importPackages(packageList);
    ctx.info("Successfully imported " + installed.size() + " packages from " + file);
    return ctx.succeeded(installed, "Packages imported successfully. Reloading package list...");
  }
}
