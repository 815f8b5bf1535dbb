package gr.imsi.athenarc.historian;

import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Preconditions;

import gr.imsi.athenarc.historian.config.HistorianSettings;
import gr.imsi.athenarc.historian.datasource.DataSourceFactory;
import gr.imsi.athenarc.historian.datasource.HistorianDataSource;
import gr.imsi.athenarc.historian.datasource.connection.DatabaseConnection;
import gr.imsi.athenarc.historian.domain.AggregateInterval;
import gr.imsi.athenarc.historian.domain.DateTimeUtil;
import gr.imsi.athenarc.historian.export.ExportPipeline;
import gr.imsi.athenarc.historian.export.ExportReport;
import gr.imsi.athenarc.historian.export.ExportRequest;
import gr.imsi.athenarc.historian.export.ExportResult;
import gr.imsi.athenarc.historian.fetch.FetchMode;
import gr.imsi.athenarc.historian.merge.FillPolicy;
import gr.imsi.athenarc.historian.tag.DroppedTag;
import gr.imsi.athenarc.historian.tag.TagCatalog;
import gr.imsi.athenarc.historian.tag.TagListRepository;
import gr.imsi.athenarc.historian.tag.TagPage;

public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @Parameter(names = "-mode", description = "Mode: 'export' (default), 'tags', 'configs', 'show', 'create', 'update' or 'delete'")
    public String mode = "export";

    @Parameter(names = "-tags", variableArity = true, description = "Tags to export, or tags of a tag list to create/update")
    public List<String> tags = new ArrayList<>();

    @Parameter(names = "-config", description = "Name of a tag list file in the configuration directory")
    public String config;

    @Parameter(names = "-start", description = "Start date (yyyy-MM-dd[ HH:mm:ss]), inclusive")
    public String start;

    @Parameter(names = "-end", description = "End date (yyyy-MM-dd[ HH:mm:ss]), exclusive")
    public String end;

    @Parameter(names = "-frequency", description = "Bucket interval as HH:MM:SS or ISO-8601 duration")
    public String frequency = "00:01:00";

    @Parameter(names = "-fill", description = "Gap fill policy: forward_backward, forward, backward or none")
    public String fill;

    @Parameter(names = "-native", description = "Let the historian resample the series itself")
    public boolean nativeResampling = false;

    @Parameter(names = "-out", description = "The output folder")
    public String outFolder;

    @Parameter(names = "-report", description = "Also write a JSON report next to the export")
    public boolean report = false;

    @Parameter(names = "-search", description = "Substring to filter tag names with")
    public String search;

    @Parameter(names = "-page", description = "Page of the tag listing, starting at 1")
    public int page = 1;

    @Parameter(names = "-perPage", description = "Tags per page of the tag listing")
    public int perPage = 250;

    @Parameter(names = "-properties", description = "Properties file overriding application.properties")
    public String propertiesFile;

    @Parameter(names = "--help", help = true, description = "Displays help")
    public boolean help;

    public static void main(String... args) {
        Main main = new Main();
        JCommander jCommander = new JCommander(main);
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            LOG.error(e.getMessage());
            jCommander.usage();
            System.exit(2);
        }
        if (main.help) {
            jCommander.usage();
            return;
        }
        try {
            main.run();
        } catch (HistorianExportException | IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            LOG.error("{}", e.getMessage());
            LOG.debug("Failure", e);
            System.exit(1);
        }
    }

    void run() {
        HistorianSettings settings = HistorianSettings.load(propertiesFile == null ? null : Paths.get(propertiesFile));
        TagListRepository repository = new TagListRepository(settings.configDirectory());
        switch (mode.toLowerCase(Locale.ROOT)) {
            case "export":
                try (HistorianDataSource<?> dataSource = DataSourceFactory.createDataSource(settings.dataSourceConfiguration())) {
                    export(dataSource, settings, repository);
                }
                break;
            case "tags":
                try (HistorianDataSource<?> dataSource = DataSourceFactory.createDataSource(settings.dataSourceConfiguration())) {
                    listTags(dataSource);
                }
                break;
            case "configs":
                repository.list().forEach(name -> LOG.info("{}", name));
                break;
            case "show":
                Preconditions.checkArgument(config != null, "You must specify a tag list with -config.");
                repository.read(config).forEach(tag -> LOG.info("{}", tag));
                break;
            case "create":
                Preconditions.checkArgument(config != null, "You must specify a tag list with -config.");
                Preconditions.checkArgument(!tags.isEmpty(), "You must specify the tags with -tags.");
                if (!repository.create(config, tags)) {
                    System.exit(1);
                }
                break;
            case "update":
                Preconditions.checkArgument(config != null, "You must specify a tag list with -config.");
                Preconditions.checkArgument(!tags.isEmpty(), "You must specify the tags with -tags.");
                if (!repository.update(config, tags)) {
                    System.exit(1);
                }
                break;
            case "delete":
                Preconditions.checkArgument(config != null, "You must specify a tag list with -config.");
                if (!repository.delete(config)) {
                    System.exit(1);
                }
                break;
            default:
                throw new IllegalArgumentException("Unknown mode: " + mode
                        + ". Supported modes are: export, tags, configs, show, create, update, delete");
        }
    }

    private <C extends DatabaseConnection> void export(HistorianDataSource<C> dataSource, HistorianSettings settings,
                                                       TagListRepository repository) {
        Preconditions.checkArgument(start != null, "You must specify a start date with -start.");
        Preconditions.checkArgument(end != null, "You must specify an end date with -end.");

        List<String> rawTags = new ArrayList<>(tags);
        String name = "export";
        if (config != null) {
            rawTags.addAll(repository.read(config));
            name = config.endsWith(".txt") ? config.substring(0, config.length() - 4) : config;
        }

        ExportRequest.Builder request = ExportRequest.builder()
                .name(name)
                .tags(rawTags)
                .start(DateTimeUtil.parseDateTimeString(start))
                .end(DateTimeUtil.parseDateTimeString(end))
                .interval(AggregateInterval.parse(frequency));
        if (fill != null) {
            request.fillPolicy(FillPolicy.parse(fill));
        }
        if (nativeResampling) {
            request.mode(FetchMode.NATIVE_RESAMPLE);
        }

        ExportPipeline<C> pipeline = ExportPipeline.builder(dataSource.getStore(), dataSource.getPool())
                .naming(settings.tagNaming())
                .outputDirectory(outFolder != null ? Paths.get(outFolder) : settings.outputDirectory())
                .chunkWidth(settings.chunkWidth())
                .fillPolicy(settings.fillPolicy())
                .mode(settings.fetchMode())
                .parallelism(settings.parallelism())
                .requestTimeout(settings.requestTimeout())
                .build();
        ExportResult result = pipeline.run(request.build());
        LOG.info("Exported {} rows of {} tags to {}", result.getRowCount(), result.getIncludedTags().size(),
                result.getOutput());
        for (DroppedTag dropped : result.getDroppedTags()) {
            LOG.warn("Not exported: {}", dropped);
        }
        if (report) {
            ExportReport.write(result);
        }
    }

    private <C extends DatabaseConnection> void listTags(HistorianDataSource<C> dataSource) {
        TagCatalog<C> catalog = new TagCatalog<>(dataSource.getStore(), dataSource.getPool());
        TagPage tagPage = catalog.search(search, page, perPage);
        tagPage.getTags().forEach(tag -> LOG.info("{}", tag));
        LOG.info("Page {} of tags matching '{}': {} of {}{}", tagPage.getPage(), search == null ? "" : search,
                tagPage.getTags().size(), tagPage.getTotal(), tagPage.isHasMore() ? ", more available" : "");
    }
}
