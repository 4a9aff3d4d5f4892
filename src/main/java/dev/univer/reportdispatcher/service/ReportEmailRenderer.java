package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.util.ScheduleParseUtil;
import org.springframework.stereotype.Component;

@Component
public class ReportEmailRenderer {

    private static final String TEMPLATE = """
            <!DOCTYPE html>
            <html>
            <head>
              <style>
                body { font-family: Arial, sans-serif; line-height: 1.6; color: #333; }
                .container { max-width: 600px; margin: 0 auto; padding: 20px; }
                .header { background: #1e293b; color: white; padding: 20px; border-radius: 8px 8px 0 0; }
                .content { background: #f8fafc; padding: 30px; border-radius: 0 0 8px 8px; }
                .summary { background: white; padding: 20px; border-radius: 8px; margin: 20px 0; border-left: 4px solid #3b82f6; }
                .footer { text-align: center; margin-top: 30px; font-size: 12px; color: #64748b; }
              </style>
            </head>
            <body>
              <div class="container">
                <div class="header">
                  <h1 style="margin: 0;">Report: %1$s</h1>
                  <p style="margin: 8px 0 0 0; opacity: 0.9;">%2$s</p>
                </div>
                <div class="content">
                  <p>Hello %3$s,</p>
                  <p>Your report %1$s is ready:</p>
                  <div class="summary">
                    <h3 style="margin-top: 0;">Summary</h3>
                    <p>%4$s</p>
                  </div>
                  <p style="margin-top: 30px;">This report was generated automatically.</p>
                </div>
                <div class="footer">
                  <p>This message was sent automatically. Please do not reply.</p>
                </div>
              </div>
            </body>
            </html>
            """;

    public String render(String tenantName, String reportName, String reportDate, String summary) {
        return String.format(TEMPLATE,
                ScheduleParseUtil.escapeHtml(reportName),
                ScheduleParseUtil.escapeHtml(reportDate),
                ScheduleParseUtil.escapeHtml(tenantName),
                ScheduleParseUtil.escapeHtml(summary));
    }
}
