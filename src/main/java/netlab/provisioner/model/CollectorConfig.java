package netlab.provisioner.model;

/**
 * Static description of one collector to deploy.
 *
 * @param nameSuffix appended to the student name, e.g. {@code IT-Collector}
 * @param switchName switch the collector is attached to
 */
public record CollectorConfig(String nameSuffix, String switchName) {

    public String nodeName(String studentName) {
        return studentName + "-" + nameSuffix;
    }
}
