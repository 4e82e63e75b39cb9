package mail.archiver.app.service;

import lombok.Value;

@Value
public class RestoreResult {
    int succeeded;
    int failed;
}
