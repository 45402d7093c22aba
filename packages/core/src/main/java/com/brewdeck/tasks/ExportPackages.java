package com.brewdeck.tasks;

import com.brewdeck.domain.PackageList;
import com.brewdeck.packagelist.PackageListFile;
import java.nio.file.Path;
import java.util.Objects;

/** Writes the installed package list to a JSON file. */
public record ExportPackages(Path file) implements SingletonTask<PackageList> {
  public ExportPackages {
    Objects.requireNonNull(file, "file");
  }

  @Override
  public TaskKind kind() {
    return TaskKind.EXPORT_PACKAGES;
  }

  @Override
  public String describe() {
    return "exporting packages to " + file;
  }

  @Override
  public TaskOutcome<PackageList> run(TaskContext ctx) throws InterruptedException {
    PackageList packageList = ctx.packageLists().exportPackageList();
    PackageListFile.write(packageList, file);
    ctx.info("Successfully exported " + packageList.totalCount() + " packages to " + file);
    return ctx.succeeded(packageList, "Packages exported successfully");
  }
}
